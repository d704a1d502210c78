package com.questrail.cbd.exceptions;

import java.util.Objects;

/**
 * A value could not be represented as CBOR.
 *
 * <p>The value model is closed, so this only happens for values outside
 * what CBOR can carry: integers beyond the 64-bit magnitude range or text
 * holding unpaired surrogates.</p>
 */
public final class CborEncodeException extends TranscodeException
{
    public enum Kind {
        UNSUPPORTED_VALUE
    }

    private final Kind kind;

    public CborEncodeException(Kind kind, String message) {
        this(kind, message, null);
    }

    public CborEncodeException(Kind kind, String message, Throwable cause) {
        super(message, NO_POSITION, cause);
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
