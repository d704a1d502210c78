package com.questrail.cbd.codec.impl;

import com.questrail.cbd.codec.CborDecoder;
import com.questrail.cbd.config.CodecConfig;
import com.questrail.cbd.exceptions.CborDecodeException;
import com.questrail.cbd.model.ArrayValue;
import com.questrail.cbd.model.BoolValue;
import com.questrail.cbd.model.ByteStringValue;
import com.questrail.cbd.model.FloatValue;
import com.questrail.cbd.model.IntegerValue;
import com.questrail.cbd.model.MapEntry;
import com.questrail.cbd.model.MapValue;
import com.questrail.cbd.model.NullValue;
import com.questrail.cbd.model.SimpleValue;
import com.questrail.cbd.model.TagValue;
import com.questrail.cbd.model.TextStringValue;
import com.questrail.cbd.model.Value;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.questrail.cbd.codec.impl.CborConstants.*;
import static com.questrail.cbd.exceptions.CborDecodeException.Kind.*;

/**
 * DefaultCborDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link CborDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Read one data item by recursive descent over initial bytes
 *       (RFC 8949 section 3)</li>
 *   <li>Verify that no bytes remain after that item</li>
 * </ol>
 *
 * <h2>Hostile input</h2>
 * <ul>
 *   <li>Every read is preceded by a length check; running out of bytes is
 *       {@code UNEXPECTED_EOF}, never an index exception.</li>
 *   <li>Declared lengths and counts are checked against the bytes actually
 *       remaining before anything is allocated for them.</li>
 *   <li>Arrays, maps and tags each consume one level of the configured
 *       maximum depth.</li>
 * </ul>
 *
 * <p>Instances hold only configuration and may be shared; per-call state
 * lives in a {@link Session}.</p>
 */
public final class DefaultCborDecoder implements CborDecoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultCborDecoder.class);

    private static final BigInteger TWO_TO_64 = BigInteger.ONE.shiftLeft(64);
    private static final BigInteger MINUS_ONE = BigInteger.ONE.negate();

    private final int maxDepth;

    public DefaultCborDecoder()
    {
        this(CodecConfig.defaults());
    }

    public DefaultCborDecoder(CodecConfig config)
    {
        this.maxDepth = Objects.requireNonNull(config, "config").maxDepth();
    }

    @Override
    public Value decode(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");

        final ByteBuf in = Unpooled.wrappedBuffer(bytes);
        try {
            final Value value = new Session(in).readItem(0);

            if (in.isReadable()) {
                throw new CborDecodeException(TRAILING_DATA, in.readerIndex(),
                        in.readableBytes() + " byte(s) after the top-level data item");
            }

            log.debug("Decoded {} CBOR byte(s) into {}", bytes.length, value.getClass().getSimpleName());
            return value;
        }
        finally {
            in.release();
        }
    }

    /**
     * State of one {@link #decode(byte[])} call.
     */
    private final class Session
    {
        private final ByteBuf in;

        Session(ByteBuf in)
        {
            this.in = in;
        }

        Value readItem(int depth)
        {
            final int offset = in.readerIndex();
            final int initial = readUnsignedByte();
            final int major = majorType(initial);
            final int info = additionalInfo(initial);

            return switch (major) {
                case MAJOR_UNSIGNED -> new IntegerValue(unsigned(readDefiniteArgument(major, info, offset)));
                case MAJOR_NEGATIVE -> new IntegerValue(MINUS_ONE.subtract(unsigned(readDefiniteArgument(major, info, offset))));
                case MAJOR_BYTE_STRING -> new ByteStringValue(readStringBytes(major, info, offset));
                case MAJOR_TEXT_STRING -> new TextStringValue(readText(major, info, offset));
                case MAJOR_ARRAY -> readArray(info, offset, depth);
                case MAJOR_MAP -> readMap(info, offset, depth);
                case MAJOR_TAG -> readTag(info, offset, depth);
                default -> readSimpleOrFloat(info, offset);
            };
        }

        // ------------------------------------------------------------------
        // Arguments
        // ------------------------------------------------------------------

        /**
         * Reads the argument that follows the initial byte. The result is an
         * unsigned 64-bit quantity carried in a {@code long}.
         */
        private long readArgument(int info, int offset)
        {
            if (info <= MAX_EMBEDDED) {
                return info;
            }
            return switch (info) {
                case ONE_BYTE -> readUnsignedByte();
                case TWO_BYTES -> {
                    require(2);
                    yield in.readUnsignedShort();
                }
                case FOUR_BYTES -> {
                    require(4);
                    yield in.readUnsignedInt();
                }
                case EIGHT_BYTES -> {
                    require(8);
                    yield in.readLong();
                }
                default -> throw new CborDecodeException(INVALID_ADDITIONAL_INFO, offset,
                        "Reserved additional info " + info);
            };
        }

        private long readDefiniteArgument(int major, int info, int offset)
        {
            if (info == INDEFINITE) {
                throw new CborDecodeException(INVALID_ADDITIONAL_INFO, offset,
                        "Indefinite length is not allowed for " + majorTypeName(major));
            }
            return readArgument(info, offset);
        }

        // ------------------------------------------------------------------
        // Strings
        // ------------------------------------------------------------------

        private byte[] readStringBytes(int major, int info, int offset)
        {
            if (info != INDEFINITE) {
                return readChunk(readArgument(info, offset));
            }

            // Indefinite: definite-length chunks of the same major type until break.
            final ByteBuf joined = Unpooled.buffer();
            try {
                while (peekUnsignedByte() != BREAK) {
                    final int chunkOffset = in.readerIndex();
                    final int chunkInitial = readUnsignedByte();
                    final int chunkInfo = additionalInfo(chunkInitial);

                    if (majorType(chunkInitial) != major || chunkInfo == INDEFINITE) {
                        throw new CborDecodeException(MALFORMED_INDEFINITE_STRING, chunkOffset,
                                "Indefinite-length " + majorTypeName(major)
                                        + " contains a chunk that is not a definite-length "
                                        + majorTypeName(major));
                    }

                    final byte[] chunk = readChunk(readArgument(chunkInfo, chunkOffset));
                    if (major == MAJOR_TEXT_STRING) {
                        // Each chunk must be valid UTF-8 on its own.
                        utf8(chunk, chunkOffset);
                    }
                    joined.writeBytes(chunk);
                }
                in.skipBytes(1);
                return ByteBufUtil.getBytes(joined);
            }
            finally {
                joined.release();
            }
        }

        private String readText(int major, int info, int offset)
        {
            return utf8(readStringBytes(major, info, offset), offset);
        }

        private byte[] readChunk(long length)
        {
            if (Long.compareUnsigned(length, in.readableBytes()) > 0) {
                throw new CborDecodeException(UNEXPECTED_EOF, in.writerIndex(),
                        "String declares " + Long.toUnsignedString(length)
                                + " byte(s) but only " + in.readableBytes() + " remain");
            }
            final byte[] out = new byte[(int) length];
            in.readBytes(out);
            return out;
        }

        private String utf8(byte[] bytes, int offset)
        {
            try {
                return StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            }
            catch (CharacterCodingException e) {
                throw new CborDecodeException(INVALID_TEXT_STRING, offset,
                        "Text string is not valid UTF-8", e);
            }
        }

        // ------------------------------------------------------------------
        // Containers
        // ------------------------------------------------------------------

        private Value readArray(int info, int offset, int depth)
        {
            enter(depth, offset);

            if (info == INDEFINITE) {
                final List<Value> items = new ArrayList<>();
                while (peekUnsignedByte() != BREAK) {
                    items.add(readItem(depth + 1));
                }
                in.skipBytes(1);
                return new ArrayValue(items);
            }

            final long count = readArgument(info, offset);
            // Every item takes at least one byte.
            requireItems(count, 1, "array");

            final List<Value> items = new ArrayList<>((int) count);
            for (long i = 0; i < count; i++) {
                items.add(readItem(depth + 1));
            }
            return new ArrayValue(items);
        }

        private Value readMap(int info, int offset, int depth)
        {
            enter(depth, offset);

            final List<MapEntry> entries = new ArrayList<>();
            if (info == INDEFINITE) {
                while (peekUnsignedByte() != BREAK) {
                    final Value key = readItem(depth + 1);
                    // A break here, between key and value, surfaces as UNEXPECTED_BREAK.
                    entries.add(new MapEntry(key, readItem(depth + 1)));
                }
                in.skipBytes(1);
                return new MapValue(entries);
            }

            final long count = readArgument(info, offset);
            requireItems(count, 2, "map");

            for (long i = 0; i < count; i++) {
                final Value key = readItem(depth + 1);
                entries.add(new MapEntry(key, readItem(depth + 1)));
            }
            return new MapValue(entries);
        }

        private Value readTag(int info, int offset, int depth)
        {
            final long tag = readDefiniteArgument(MAJOR_TAG, info, offset);
            enter(depth, offset);
            return new TagValue(tag, readItem(depth + 1));
        }

        private void enter(int depth, int offset)
        {
            if (depth >= maxDepth) {
                throw new CborDecodeException(DEPTH_EXCEEDED, offset,
                        "Nesting exceeds the maximum depth of " + maxDepth);
            }
        }

        private void requireItems(long count, int minBytesPerItem, String what)
        {
            if (Long.compareUnsigned(count, in.readableBytes() / minBytesPerItem) > 0) {
                throw new CborDecodeException(UNEXPECTED_EOF, in.writerIndex(),
                        "The " + what + " declares " + Long.toUnsignedString(count)
                                + " item(s) but only " + in.readableBytes() + " byte(s) remain");
            }
        }

        // ------------------------------------------------------------------
        // Major type 7
        // ------------------------------------------------------------------

        private Value readSimpleOrFloat(int info, int offset)
        {
            if (info < SIMPLE_FALSE) {
                return new SimpleValue(info);
            }
            return switch (info) {
                case SIMPLE_FALSE -> BoolValue.FALSE;
                case SIMPLE_TRUE -> BoolValue.TRUE;
                case SIMPLE_NULL -> NullValue.INSTANCE;
                case SIMPLE_UNDEFINED -> new SimpleValue(SimpleValue.UNDEFINED);
                case SIMPLE_ONE_BYTE -> {
                    final int code = readUnsignedByte();
                    if (code < MIN_ONE_BYTE_SIMPLE) {
                        throw new CborDecodeException(INVALID_ADDITIONAL_INFO, offset,
                                "Simple value " + code + " must use the one-byte form");
                    }
                    yield new SimpleValue(code);
                }
                case HALF_FLOAT -> {
                    require(2);
                    yield new FloatValue(CborFloats.halfToDouble(in.readUnsignedShort()));
                }
                case SINGLE_FLOAT -> {
                    require(4);
                    yield new FloatValue(in.readFloat());
                }
                case DOUBLE_FLOAT -> {
                    require(8);
                    yield new FloatValue(in.readDouble());
                }
                case INDEFINITE -> throw new CborDecodeException(UNEXPECTED_BREAK, offset,
                        "Break stop code outside an indefinite-length item");
                default -> throw new CborDecodeException(INVALID_ADDITIONAL_INFO, offset,
                        "Reserved additional info " + info);
            };
        }

        // ------------------------------------------------------------------
        // Raw reads
        // ------------------------------------------------------------------

        private int readUnsignedByte()
        {
            require(1);
            return in.readUnsignedByte();
        }

        private int peekUnsignedByte()
        {
            require(1);
            return in.getUnsignedByte(in.readerIndex());
        }

        private void require(int n)
        {
            if (in.readableBytes() < n) {
                throw new CborDecodeException(UNEXPECTED_EOF, in.writerIndex(),
                        "Input ended " + (n - in.readableBytes()) + " byte(s) short");
            }
        }
    }

    private static BigInteger unsigned(long value)
    {
        final BigInteger big = BigInteger.valueOf(value);
        return (value >= 0) ? big : big.add(TWO_TO_64);
    }
}
