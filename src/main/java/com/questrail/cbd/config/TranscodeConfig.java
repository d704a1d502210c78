package com.questrail.cbd.config;

import java.util.Objects;

/**
 * Aggregated configuration for one transcode invocation.
 */
public record TranscodeConfig(
    TranscodeDirection direction,
    Base64Mode base64Mode,
    CodecConfig codec
) {
    public TranscodeConfig {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(base64Mode, "base64Mode");
        Objects.requireNonNull(codec, "codec");
    }

    public static TranscodeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TranscodeDirection direction = TranscodeDirection.DECODE;
        private Base64Mode base64Mode = Base64Mode.OFF;
        private CodecConfig codec = CodecConfig.defaults();

        public Builder withDirection(TranscodeDirection direction) {
            this.direction = direction;
            return this;
        }

        public Builder withBase64Mode(Base64Mode base64Mode) {
            this.base64Mode = base64Mode;
            return this;
        }

        public Builder withCodec(CodecConfig codec) {
            this.codec = codec;
            return this;
        }

        public TranscodeConfig build() {
            return new TranscodeConfig(direction, base64Mode, codec);
        }
    }
}
