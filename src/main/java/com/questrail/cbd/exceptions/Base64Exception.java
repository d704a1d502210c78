package com.questrail.cbd.exceptions;

import java.util.Objects;

/**
 * Text could not be decoded as base64.
 */
public final class Base64Exception extends TranscodeException
{
    public enum Kind {
        /** Character outside the base64 alphabets, or both alphabets mixed. */
        INVALID_CHARACTER,
        /** Length or padding that no base64 encoding can produce. */
        INVALID_LENGTH
    }

    private final Kind kind;

    public Base64Exception(Kind kind, long offset, String message) {
        this(kind, offset, message, null);
    }

    public Base64Exception(Kind kind, long offset, String message, Throwable cause) {
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
