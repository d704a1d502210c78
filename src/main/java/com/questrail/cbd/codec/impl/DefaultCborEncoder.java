package com.questrail.cbd.codec.impl;

import com.questrail.cbd.codec.CborEncoder;
import com.questrail.cbd.exceptions.CborEncodeException;
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
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static com.questrail.cbd.codec.impl.CborConstants.*;
import static com.questrail.cbd.exceptions.CborEncodeException.Kind.UNSUPPORTED_VALUE;

/**
 * DefaultCborEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link CborEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultCborDecoder}, with a
 * fixed set of output rules:</p>
 * <ul>
 *   <li>Arguments (integers, lengths, tag numbers) use the shortest of the
 *       embedded, 1, 2, 4 and 8 byte forms</li>
 *   <li>Strings, arrays and maps always carry a definite length</li>
 *   <li>Floats are always written as 64-bit doubles</li>
 *   <li>Map entries are written in stored order, never sorted</li>
 * </ul>
 *
 * <p>Only the last two differ from canonical CBOR.</p>
 */
public final class DefaultCborEncoder implements CborEncoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultCborEncoder.class);

    private static final BigInteger MINUS_ONE = BigInteger.ONE.negate();

    @Override
    public byte[] encode(Value value)
    {
        Objects.requireNonNull(value, "value");

        final ByteBuf out = Unpooled.buffer();
        try {
            writeItem(out, value);
            final byte[] bytes = ByteBufUtil.getBytes(out);
            log.debug("Encoded {} into {} CBOR byte(s)", value.getClass().getSimpleName(), bytes.length);
            return bytes;
        }
        finally {
            out.release();
        }
    }

    private static void writeItem(ByteBuf out, Value value)
    {
        if (value instanceof NullValue) {
            out.writeByte(initialByte(MAJOR_SIMPLE, SIMPLE_NULL));
        }
        else if (value instanceof BoolValue b) {
            out.writeByte(initialByte(MAJOR_SIMPLE, b.value() ? SIMPLE_TRUE : SIMPLE_FALSE));
        }
        else if (value instanceof IntegerValue i) {
            writeInteger(out, i);
        }
        else if (value instanceof FloatValue f) {
            out.writeByte(initialByte(MAJOR_SIMPLE, DOUBLE_FLOAT));
            out.writeDouble(f.value());
        }
        else if (value instanceof ByteStringValue b) {
            final byte[] bytes = b.value();
            writeHeader(out, MAJOR_BYTE_STRING, bytes.length);
            out.writeBytes(bytes);
        }
        else if (value instanceof TextStringValue t) {
            final byte[] bytes = utf8(t.value());
            writeHeader(out, MAJOR_TEXT_STRING, bytes.length);
            out.writeBytes(bytes);
        }
        else if (value instanceof ArrayValue a) {
            writeHeader(out, MAJOR_ARRAY, a.size());
            for (Value item : a.items()) {
                writeItem(out, item);
            }
        }
        else if (value instanceof MapValue m) {
            writeHeader(out, MAJOR_MAP, m.size());
            for (MapEntry entry : m.entries()) {
                writeItem(out, entry.key());
                writeItem(out, entry.value());
            }
        }
        else if (value instanceof TagValue t) {
            writeHeader(out, MAJOR_TAG, t.tag());
            writeItem(out, t.content());
        }
        else if (value instanceof SimpleValue s) {
            writeSimple(out, s.code());
        }
        else {
            // Sealed interface should make this unreachable.
            throw new IllegalArgumentException("Unsupported value type: " + value.getClass());
        }
    }

    private static void writeInteger(ByteBuf out, IntegerValue integer)
    {
        if (!integer.fitsCbor()) {
            throw new CborEncodeException(UNSUPPORTED_VALUE,
                    "Integer " + integer.value() + " is outside the CBOR range -2^64..2^64-1");
        }

        final BigInteger value = integer.value();
        if (value.signum() >= 0) {
            // longValue() keeps the low 64 bits, which is the unsigned argument.
            writeHeader(out, MAJOR_UNSIGNED, value.longValue());
        }
        else {
            writeHeader(out, MAJOR_NEGATIVE, MINUS_ONE.subtract(value).longValue());
        }
    }

    private static void writeSimple(ByteBuf out, int code)
    {
        // SimpleValue never holds 24-31, so anything above 23 takes the one-byte form.
        if (code <= MAX_EMBEDDED) {
            out.writeByte(initialByte(MAJOR_SIMPLE, code));
        }
        else {
            out.writeByte(initialByte(MAJOR_SIMPLE, SIMPLE_ONE_BYTE));
            out.writeByte(code);
        }
    }

    /**
     * Writes an initial byte and its argument in the shortest form.
     *
     * @param argument unsigned 64-bit argument
     */
    static void writeHeader(ByteBuf out, int major, long argument)
    {
        if (Long.compareUnsigned(argument, MAX_EMBEDDED) <= 0) {
            out.writeByte(initialByte(major, (int) argument));
        }
        else if (Long.compareUnsigned(argument, 0xFFL) <= 0) {
            out.writeByte(initialByte(major, ONE_BYTE));
            out.writeByte((int) argument);
        }
        else if (Long.compareUnsigned(argument, 0xFFFFL) <= 0) {
            out.writeByte(initialByte(major, TWO_BYTES));
            out.writeShort((int) argument);
        }
        else if (Long.compareUnsigned(argument, 0xFFFFFFFFL) <= 0) {
            out.writeByte(initialByte(major, FOUR_BYTES));
            out.writeInt((int) argument);
        }
        else {
            out.writeByte(initialByte(major, EIGHT_BYTES));
            out.writeLong(argument);
        }
    }

    private static byte[] utf8(String text)
    {
        try {
            final ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));
            final byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        }
        catch (CharacterCodingException e) {
            throw new CborEncodeException(UNSUPPORTED_VALUE,
                    "Text string contains an unpaired surrogate and cannot be encoded as UTF-8", e);
        }
    }
}
