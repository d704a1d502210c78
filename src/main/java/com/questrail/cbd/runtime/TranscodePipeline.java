package com.questrail.cbd.runtime;

import com.questrail.cbd.codec.Base64Codec;
import com.questrail.cbd.codec.CborDecoder;
import com.questrail.cbd.codec.CborEncoder;
import com.questrail.cbd.codec.JsonParser;
import com.questrail.cbd.codec.JsonPrinter;
import com.questrail.cbd.codec.impl.DefaultBase64Codec;
import com.questrail.cbd.codec.impl.DefaultCborDecoder;
import com.questrail.cbd.codec.impl.DefaultCborEncoder;
import com.questrail.cbd.codec.impl.DefaultJsonParser;
import com.questrail.cbd.codec.impl.DefaultJsonPrinter;
import com.questrail.cbd.config.Base64Mode;
import com.questrail.cbd.config.CodecConfig;
import com.questrail.cbd.config.TranscodeConfig;
import com.questrail.cbd.config.TranscodeDirection;
import com.questrail.cbd.exceptions.Base64Exception;
import com.questrail.cbd.exceptions.CborDecodeException;
import com.questrail.cbd.exceptions.JsonParseException;
import com.questrail.cbd.exceptions.TranscodeException;
import com.questrail.cbd.exceptions.TranscodeIoException;
import com.questrail.cbd.model.Value;
import com.questrail.cbd.observability.NullObservabilitySink;
import com.questrail.cbd.observability.TranscodeCompletedEvent;
import com.questrail.cbd.observability.TranscodeErrorEvent;
import com.questrail.cbd.observability.TranscodeObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * TranscodePipeline
 * =============================================================================
 * Composition root for one transcode direction.
 *
 * <pre>
 *   DECODE:  bytes -> [base64 decode] -> CborDecoder -> JsonPrinter -> text + "\n"
 *   ENCODE:  bytes -> UTF-8 -> JsonParser -> CborEncoder -> [base64 encode] -> bytes
 * </pre>
 *
 * <p>The whole input is buffered and the whole output is produced before
 * anything is written, so a failure never leaves partial output behind.
 * Failures are reported to the observability sink and then rethrown
 * unchanged.</p>
 */
public final class TranscodePipeline {
    private static final Logger log = LoggerFactory.getLogger(TranscodePipeline.class);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final TranscodeConfig config;
    private final CborDecoder cborDecoder;
    private final CborEncoder cborEncoder;
    private final JsonParser jsonParser;
    private final JsonPrinter jsonPrinter;
    private final Base64Codec base64Codec;
    private final TranscodeObservabilitySink observabilitySink;

    private TranscodePipeline(TranscodeConfig config, TranscodeObservabilitySink observabilitySink) {
        final CodecConfig codec = config.codec();
        this.config = config;
        this.cborDecoder = new DefaultCborDecoder(codec);
        this.cborEncoder = new DefaultCborEncoder();
        this.jsonParser = new DefaultJsonParser(codec);
        this.jsonPrinter = new DefaultJsonPrinter(codec);
        this.base64Codec = new DefaultBase64Codec(codec.base64Alphabet());
        this.observabilitySink = observabilitySink;
    }

    public TranscodeConfig config() {
        return config;
    }

    /**
     * Reads all of {@code in}, transcodes it in the configured direction and
     * writes the result to {@code out}.
     *
     * @throws TranscodeException on any failure, including I/O
     *         ({@link TranscodeIoException})
     */
    public void run(InputStream in, OutputStream out) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(out, "out");

        final byte[] input;
        try {
            input = in.readAllBytes();
        } catch (IOException e) {
            throw report(config.direction(), new TranscodeIoException("Failed to read input: " + e.getMessage(), e));
        }

        final byte[] output = transcode(input);

        try {
            out.write(output);
            out.flush();
        } catch (IOException e) {
            throw report(config.direction(), new TranscodeIoException("Failed to write output: " + e.getMessage(), e));
        }
    }

    /**
     * Transcodes a complete input in the configured direction.
     */
    public byte[] transcode(byte[] input) {
        return config.direction() == TranscodeDirection.ENCODE ? encode(input) : decode(input);
    }

    /**
     * CBOR (raw or base64 per configuration) to JSON text, UTF-8 encoded and
     * terminated by a newline.
     */
    public byte[] decode(byte[] input) {
        Objects.requireNonNull(input, "input");
        final long started = System.nanoTime();
        try {
            boolean base64 = false;
            Value value;

            switch (config.base64Mode()) {
                case ON:
                    base64 = true;
                    value = cborDecoder.decode(base64Codec.decode(latin1(input)));
                    break;
                case AUTO:
                    value = probeBase64(input);
                    base64 = value != null;
                    if (value == null) {
                        value = cborDecoder.decode(input);
                    }
                    break;
                default:
                    value = cborDecoder.decode(input);
                    break;
            }

            final byte[] output = (jsonPrinter.print(value) + "\n").getBytes(StandardCharsets.UTF_8);
            completed(TranscodeDirection.DECODE, base64, input.length, output.length, started);
            return output;
        } catch (TranscodeException e) {
            throw report(TranscodeDirection.DECODE, e);
        }
    }

    /**
     * UTF-8 JSON text to CBOR, raw or as base64 text per configuration.
     * A leading byte-order mark is ignored.
     */
    public byte[] encode(byte[] input) {
        Objects.requireNonNull(input, "input");
        final long started = System.nanoTime();
        try {
            final Value value = jsonParser.parse(utf8(input));
            final byte[] cbor = cborEncoder.encode(value);

            final boolean base64 = config.base64Mode() == Base64Mode.ON;
            final byte[] output = base64
                    ? base64Codec.encode(cbor).getBytes(StandardCharsets.US_ASCII)
                    : cbor;

            completed(TranscodeDirection.ENCODE, base64, input.length, output.length, started);
            return output;
        } catch (TranscodeException e) {
            throw report(TranscodeDirection.ENCODE, e);
        }
    }

    /**
     * Returns the value if the input is base64 text holding one well-formed
     * CBOR item, otherwise {@code null}.
     */
    private Value probeBase64(byte[] input) {
        final byte[] cbor;
        try {
            cbor = base64Codec.decode(latin1(input));
        } catch (Base64Exception e) {
            log.debug("Input is not base64 ({}), reading it as raw CBOR", e.describe());
            return null;
        }

        try {
            return cborDecoder.decode(cbor);
        } catch (CborDecodeException e) {
            log.debug("Base64 content is not CBOR ({}), reading input as raw CBOR", e.describe());
            return null;
        }
    }

    private void completed(TranscodeDirection direction, boolean base64, int inputBytes, int outputBytes, long started) {
        observabilitySink.onTranscodeCompleted(new TranscodeCompletedEvent(
            Instant.now(),
            direction,
            base64,
            inputBytes,
            outputBytes,
            Duration.ofNanos(System.nanoTime() - started)
        ));
    }

    private TranscodeException report(TranscodeDirection direction, TranscodeException e) {
        observabilitySink.onError(new TranscodeErrorEvent(Instant.now(), direction, e));
        return e;
    }

    /**
     * Base64 text is ASCII; mapping bytes one-to-one keeps character offsets
     * equal to byte offsets and leaves any other byte to be rejected as an
     * invalid character.
     */
    private static String latin1(byte[] input) {
        return new String(input, StandardCharsets.ISO_8859_1);
    }

    private static String utf8(byte[] input) {
        final int start = startsWithBom(input) ? UTF8_BOM.length : 0;

        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        final ByteBuffer in = ByteBuffer.wrap(input, start, input.length - start);
        final CharBuffer out = CharBuffer.allocate(input.length - start);

        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            final int offset = in.position();
            throw invalidUtf8(input, start, offset);
        }
        out.flip();
        return out.toString();
    }

    private static JsonParseException invalidUtf8(byte[] input, int start, int offset) {
        int line = 1;
        int lineStart = start;
        for (int i = start; i < offset; i++) {
            if (input[i] == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        final String message = offset < input.length
                ? String.format("Invalid UTF-8 byte 0x%02X in JSON text", input[offset] & 0xFF)
                : "Truncated UTF-8 sequence at end of JSON text";
        return new JsonParseException(JsonParseException.Kind.SYNTAX_ERROR, offset, line, offset - lineStart + 1, message);
    }

    private static boolean startsWithBom(byte[] input) {
        return input.length >= UTF8_BOM.length
                && input[0] == UTF8_BOM[0]
                && input[1] == UTF8_BOM[1]
                && input[2] == UTF8_BOM[2];
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TranscodeConfig config = TranscodeConfig.defaults();
        private TranscodeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(TranscodeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(TranscodeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public TranscodePipeline build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            return new TranscodePipeline(config, observabilitySink);
        }
    }
}
