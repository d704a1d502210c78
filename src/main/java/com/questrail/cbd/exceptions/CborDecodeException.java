package com.questrail.cbd.exceptions;

import java.util.Objects;

/**
 * Raw bytes could not be decoded as exactly one well-formed CBOR data item.
 *
 * <p>The position is the byte offset at which decoding stopped.</p>
 */
public final class CborDecodeException extends TranscodeException
{
    public enum Kind {
        /** Input ended in the middle of a data item. */
        UNEXPECTED_EOF,
        /** Additional info 28-30, or 31 on a major type that has no indefinite form. */
        INVALID_ADDITIONAL_INFO,
        /** Break stop code outside an indefinite-length container. */
        UNEXPECTED_BREAK,
        /** Indefinite-length string containing something other than definite chunks of its own type. */
        MALFORMED_INDEFINITE_STRING,
        /** Text string that is not valid UTF-8. */
        INVALID_TEXT_STRING,
        /** Nesting deeper than the configured maximum. */
        DEPTH_EXCEEDED,
        /** Bytes left over after the single top-level item. */
        TRAILING_DATA
    }

    private final Kind kind;

    public CborDecodeException(Kind kind, long offset, String message) {
        this(kind, offset, message, null);
    }

    public CborDecodeException(Kind kind, long offset, String message, Throwable cause) {
        super(message, offset, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String kindName() {
        return label(kind);
    }
}
