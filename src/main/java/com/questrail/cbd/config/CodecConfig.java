package com.questrail.cbd.config;

import java.util.Objects;

/**
 * CodecConfig
 * -----------------------------------------------------------------------------
 * Limits and projection policies shared by the four codecs.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxDepth</b> - Maximum nesting of arrays, maps and tags accepted by
 *       the CBOR decoder and the JSON parser. Bounds recursion on adversarial
 *       input. Must be at least 1.</li>
 *   <li><b>byteStringPolicy</b> - How the JSON printer renders byte strings.</li>
 *   <li><b>jsonStyle</b> - Separator style of the JSON printer.</li>
 *   <li><b>base64Alphabet</b> - Alphabet for base64 output, including byte
 *       strings projected into JSON.</li>
 * </ul>
 */
public record CodecConfig(
        int maxDepth,
        ByteStringPolicy byteStringPolicy,
        JsonStyle jsonStyle,
        Base64Alphabet base64Alphabet
) {
    public static final int DEFAULT_MAX_DEPTH = 512;

    public CodecConfig {
        Objects.requireNonNull(byteStringPolicy, "byteStringPolicy");
        Objects.requireNonNull(jsonStyle, "jsonStyle");
        Objects.requireNonNull(base64Alphabet, "base64Alphabet");

        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1 (was " + maxDepth + ")");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>maxDepth: 512</li>
     *   <li>byteStringPolicy: BASE64</li>
     *   <li>jsonStyle: SPACED</li>
     *   <li>base64Alphabet: STANDARD</li>
     * </ul>
     */
    public static CodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private ByteStringPolicy byteStringPolicy = ByteStringPolicy.BASE64;
        private JsonStyle jsonStyle = JsonStyle.SPACED;
        private Base64Alphabet base64Alphabet = Base64Alphabet.STANDARD;

        public Builder withMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder withByteStringPolicy(ByteStringPolicy byteStringPolicy) {
            this.byteStringPolicy = byteStringPolicy;
            return this;
        }

        public Builder withJsonStyle(JsonStyle jsonStyle) {
            this.jsonStyle = jsonStyle;
            return this;
        }

        public Builder withBase64Alphabet(Base64Alphabet base64Alphabet) {
            this.base64Alphabet = base64Alphabet;
            return this;
        }

        public CodecConfig build() {
            return new CodecConfig(maxDepth, byteStringPolicy, jsonStyle, base64Alphabet);
        }
    }
}
