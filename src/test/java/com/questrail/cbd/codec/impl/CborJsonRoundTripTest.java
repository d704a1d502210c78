package com.questrail.cbd.codec.impl;

import com.questrail.cbd.config.Base64Alphabet;
import com.questrail.cbd.config.CodecConfig;
import com.questrail.cbd.config.JsonStyle;
import com.questrail.cbd.model.MapValue;
import com.questrail.cbd.model.Value;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CborJsonRoundTripTest
 * -----------------------------------------------------------------------------
 * Cross-codec tests: JSON to CBOR and back, optionally through base64 in
 * every accepted shape, using the compact printer so that output is
 * byte-for-byte comparable with the input.
 */
final class CborJsonRoundTripTest
{
    private static final String JSON_IN =
            "[{\"key1\":\"value1\",\"key2\":\"value2\"},{\"foo\":\"bar\"},true,false,0,1.0]";

    private final CodecConfig config = CodecConfig.builder().withJsonStyle(JsonStyle.COMPACT).build();

    private final DefaultJsonParser parser = new DefaultJsonParser(config);
    private final DefaultJsonPrinter printer = new DefaultJsonPrinter(config);
    private final DefaultCborEncoder encoder = new DefaultCborEncoder();
    private final DefaultCborDecoder decoder = new DefaultCborDecoder(config);

    @Test
    void singleEntryMapMatchesKnownBytes()
    {
        byte[] cbor = encoder.encode(parser.parse("{\"k\":\"v\"}"));

        assertArrayEquals(HexFormat.of().parseHex("a1616b6176"), cbor);
        assertEquals("{\"k\":\"v\"}", printer.print(decoder.decode(cbor)));
    }

    @Test
    void rawCborRoundTrip()
    {
        byte[] cbor = encoder.encode(parser.parse(JSON_IN));

        assertEquals(JSON_IN, printer.print(decoder.decode(cbor)));
    }

    @Test
    void standardBase64RoundTrip()
    {
        assertBase64RoundTrip(Base64Alphabet.STANDARD, false);
        assertBase64RoundTrip(Base64Alphabet.STANDARD, true);
    }

    @Test
    void urlSafeBase64RoundTrip()
    {
        assertBase64RoundTrip(Base64Alphabet.URL_SAFE, false);
        assertBase64RoundTrip(Base64Alphabet.URL_SAFE, true);
    }

    @Test
    void integerAndFloatSurviveTheRoundTrip()
    {
        byte[] integer = encoder.encode(parser.parse("42"));
        byte[] floating = encoder.encode(parser.parse("42.0"));

        assertEquals(0, (integer[0] & 0xFF) >> 5);
        assertEquals(0xFB, floating[0] & 0xFF);
        assertEquals("42", printer.print(decoder.decode(integer)));
        assertEquals("42.0", printer.print(decoder.decode(floating)));
    }

    @Test
    void decodeInvertsEncodeForDefiniteValues()
    {
        Value value = MapValue.builder()
                .put("bytes", Value.bytes(new byte[] { 0, (byte) 0xFF }))
                .put(Value.integer(-5), Value.tag(1, Value.floating(1.5)))
                .put("list", Value.array(Value.nullValue(), Value.simple(16), Value.bool(true)))
                .build();

        assertEquals(value, decoder.decode(encoder.encode(value)));
    }

    @Test
    void parseInvertsPrintForParsedValues()
    {
        Value parsed = parser.parse("{\"a\":[1,-2.5,\"x\\n\",null],\"a\":{}}");

        assertEquals(parsed, parser.parse(printer.print(parsed)));
        assertEquals(parsed, parser.parse(new DefaultJsonPrinter().print(parsed)));
    }

    private void assertBase64RoundTrip(Base64Alphabet alphabet, boolean padded)
    {
        DefaultBase64Codec base64 = new DefaultBase64Codec(alphabet);

        String text = base64.encode(encoder.encode(parser.parse(JSON_IN)));
        if (padded) {
            text = text + "=".repeat((4 - text.length() % 4) % 4);
        }

        String json = printer.print(decoder.decode(base64.decode(text)));
        assertEquals(JSON_IN, json, () -> alphabet + (padded ? " padded" : " unpadded"));
    }
}
