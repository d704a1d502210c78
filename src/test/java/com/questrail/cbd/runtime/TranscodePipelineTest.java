package com.questrail.cbd.runtime;

import com.questrail.cbd.config.Base64Alphabet;
import com.questrail.cbd.config.Base64Mode;
import com.questrail.cbd.config.CodecConfig;
import com.questrail.cbd.config.TranscodeConfig;
import com.questrail.cbd.config.TranscodeDirection;
import com.questrail.cbd.exceptions.Base64Exception;
import com.questrail.cbd.exceptions.CborDecodeException;
import com.questrail.cbd.exceptions.JsonParseException;
import com.questrail.cbd.exceptions.TranscodeIoException;
import com.questrail.cbd.observability.RecordingObservabilitySink;
import com.questrail.cbd.observability.TranscodeCompletedEvent;
import com.questrail.cbd.observability.TranscodeErrorEvent;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TranscodePipelineTest
 * =============================================================================
 * End-to-end tests of both directions, the base64 modes and failure
 * reporting through the observability sink.
 */
final class TranscodePipelineTest {

    private static final byte[] KEY_VALUE_CBOR = HexFormat.of().parseHex("a1636b65796576616c7565");
    private static final String KEY_VALUE_JSON = "{\"key\": \"value\"}\n";

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    @Test
    void decodesRawCborToJsonLine() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.OFF);

        assertEquals(KEY_VALUE_JSON, utf8(pipeline.transcode(KEY_VALUE_CBOR)));
    }

    @Test
    void decodesBase64Cbor() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.ON);

        assertEquals(KEY_VALUE_JSON, utf8(pipeline.transcode(ascii("oWNrZXlldmFsdWU\n"))));
        assertTrue(sink.getCompletions().get(0).base64());
    }

    @Test
    void base64ModeRejectsRawCbor() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.ON);

        Base64Exception e = assertThrows(Base64Exception.class, () -> pipeline.transcode(KEY_VALUE_CBOR));
        assertEquals(Base64Exception.Kind.INVALID_CHARACTER, e.kind());
        assertEquals(0, e.position());
    }

    @Test
    void autoModeDetectsBase64() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.AUTO);

        assertEquals(KEY_VALUE_JSON, utf8(pipeline.transcode(ascii("oWNrZXlldmFsdWU="))));
        assertTrue(sink.getCompletions().get(0).base64());
    }

    @Test
    void autoModeFallsBackToRawCbor() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.AUTO);

        assertEquals(KEY_VALUE_JSON, utf8(pipeline.transcode(KEY_VALUE_CBOR)));
        assertFalse(sink.getCompletions().get(0).base64());
    }

    @Test
    void autoModeReportsRawDecodeFailure() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.AUTO);

        CborDecodeException e = assertThrows(CborDecodeException.class,
            () -> pipeline.transcode(new byte[] {(byte) 0xA1}));
        assertEquals(CborDecodeException.Kind.UNEXPECTED_EOF, e.kind());
    }

    @Test
    void encodesJsonToRawCbor() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.ENCODE, Base64Mode.OFF);

        assertArrayEquals(HexFormat.of().parseHex("a1616b6176"), pipeline.transcode(utf8Bytes("{\"k\":\"v\"}")));
    }

    @Test
    void encodesJsonToUnpaddedBase64WithoutNewline() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.ENCODE, Base64Mode.ON);

        assertEquals("oWFrYXY", utf8(pipeline.transcode(utf8Bytes("{\"k\":\"v\"}\n"))));
    }

    @Test
    void encodesWithUrlSafeAlphabet() {
        TranscodePipeline pipeline = TranscodePipeline.builder()
            .withConfig(TranscodeConfig.builder()
                .withDirection(TranscodeDirection.ENCODE)
                .withBase64Mode(Base64Mode.ON)
                .withCodec(CodecConfig.builder().withBase64Alphabet(Base64Alphabet.URL_SAFE).build())
                .build())
            .build();

        assertEquals("GQP_", utf8(pipeline.transcode(utf8Bytes("1023"))));
    }

    @Test
    void autoModeEncodesRawCbor() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.ENCODE, Base64Mode.AUTO);

        assertArrayEquals(HexFormat.of().parseHex("a1616b6176"), pipeline.transcode(utf8Bytes("{\"k\":\"v\"}")));
    }

    @Test
    void ignoresLeadingByteOrderMark() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.ENCODE, Base64Mode.OFF);
        byte[] input = HexFormat.of().parseHex("efbbbf" + HexFormat.of().formatHex(utf8Bytes("{\"k\":\"v\"}")));

        assertArrayEquals(HexFormat.of().parseHex("a1616b6176"), pipeline.transcode(input));
    }

    @Test
    void rejectsInvalidUtf8Json() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.ENCODE, Base64Mode.OFF);

        JsonParseException e = assertThrows(JsonParseException.class,
            () -> pipeline.transcode(new byte[] {'[', '"', (byte) 0xFF, '"', ']'}));
        assertEquals(JsonParseException.Kind.SYNTAX_ERROR, e.kind());
        assertEquals(2, e.position());
    }

    @Test
    void rejectsTruncatedUtf8Json() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.ENCODE, Base64Mode.OFF);

        JsonParseException e = assertThrows(JsonParseException.class,
            () -> pipeline.transcode(new byte[] {'"', (byte) 0xC3}));
        assertEquals(1, e.position());
    }

    @Test
    void reportsCompletionToSink() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.OFF);

        pipeline.transcode(KEY_VALUE_CBOR);

        assertEquals(1, sink.getAllEvents().size());
        TranscodeCompletedEvent event = sink.getCompletions().get(0);
        assertEquals(TranscodeDirection.DECODE, event.direction());
        assertEquals(KEY_VALUE_CBOR.length, event.inputBytes());
        assertEquals(KEY_VALUE_JSON.length(), event.outputBytes());
        assertFalse(event.base64());
    }

    @Test
    void reportsFailureToSinkAndRethrows() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.OFF);

        CborDecodeException e = assertThrows(CborDecodeException.class,
            () -> pipeline.transcode(new byte[] {(byte) 0xA1}));

        assertTrue(sink.getCompletions().isEmpty());
        TranscodeErrorEvent error = sink.getErrors().get(0);
        assertSame(e, error.cause());
        assertEquals("UnexpectedEof at offset 1: " + e.getMessage(), error.message());
    }

    @Test
    void runWritesCompleteOutput() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.OFF);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        pipeline.run(new ByteArrayInputStream(KEY_VALUE_CBOR), out);

        assertEquals(KEY_VALUE_JSON, utf8(out.toByteArray()));
    }

    @Test
    void runWritesNothingOnFailure() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.ENCODE, Base64Mode.OFF);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertThrows(JsonParseException.class,
            () -> pipeline.run(new ByteArrayInputStream(utf8Bytes("[1, 2")), out));
        assertEquals(0, out.size());
    }

    @Test
    void readFailureBecomesIoError() {
        TranscodePipeline pipeline = pipeline(TranscodeDirection.DECODE, Base64Mode.OFF);
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("device unplugged");
            }
        };

        TranscodeIoException e = assertThrows(TranscodeIoException.class,
            () -> pipeline.run(broken, new ByteArrayOutputStream()));
        assertEquals("device unplugged", e.getCause().getMessage());
        assertEquals(1, sink.getErrors().size());
    }

    private TranscodePipeline pipeline(TranscodeDirection direction, Base64Mode base64Mode) {
        return TranscodePipeline.builder()
            .withConfig(TranscodeConfig.builder()
                .withDirection(direction)
                .withBase64Mode(base64Mode)
                .build())
            .withObservabilitySink(sink)
            .build();
    }

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    private static byte[] utf8Bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static String utf8(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
