package com.questrail.cbd.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class CodecConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        CodecConfig config = CodecConfig.defaults();

        assertEquals(512, config.maxDepth());
        assertEquals(ByteStringPolicy.BASE64, config.byteStringPolicy());
        assertEquals(JsonStyle.SPACED, config.jsonStyle());
        assertEquals(Base64Alphabet.STANDARD, config.base64Alphabet());
    }

    @Test
    void builderOverridesEachField() {
        CodecConfig config = CodecConfig.builder()
            .withMaxDepth(8)
            .withByteStringPolicy(ByteStringPolicy.REJECT)
            .withJsonStyle(JsonStyle.COMPACT)
            .withBase64Alphabet(Base64Alphabet.URL_SAFE)
            .build();

        assertEquals(new CodecConfig(8, ByteStringPolicy.REJECT, JsonStyle.COMPACT, Base64Alphabet.URL_SAFE), config);
    }

    @Test
    void maxDepthMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> CodecConfig.builder().withMaxDepth(0).build());
        assertDoesNotThrow(() -> CodecConfig.builder().withMaxDepth(1).build());
    }

    @Test
    void policiesAreRequired() {
        assertThrows(NullPointerException.class, () -> CodecConfig.builder().withJsonStyle(null).build());
    }

    @Test
    void transcodeDefaultsDecodeRawCbor() {
        TranscodeConfig config = TranscodeConfig.defaults();

        assertEquals(TranscodeDirection.DECODE, config.direction());
        assertEquals(Base64Mode.OFF, config.base64Mode());
        assertEquals(CodecConfig.defaults(), config.codec());
    }

    @Test
    void jsonStylesDifferOnlyInMemberSeparator() {
        assertEquals(": ", JsonStyle.SPACED.memberSeparator());
        assertEquals(":", JsonStyle.COMPACT.memberSeparator());
        assertEquals(JsonStyle.SPACED.elementSeparator(), JsonStyle.COMPACT.elementSeparator());
    }
}
