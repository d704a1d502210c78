package com.questrail.cbd.exceptions;

import java.util.Objects;

/**
 * A value has no JSON rendering under the configured policies.
 */
public final class JsonPrintException extends TranscodeException
{
    public enum Kind {
        /** Map key that is neither a text string nor an integer. */
        NON_STRING_MAP_KEY,
        /** Byte string while byte strings are configured to be rejected. */
        UNSUPPORTED_VALUE
    }

    private final Kind kind;

    public JsonPrintException(Kind kind, String message) {
        super(message, NO_POSITION, null);
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
