package com.questrail.cbd.exceptions;

import java.util.Objects;

/**
 * The input text is not exactly one valid JSON value.
 *
 * <p>The position is a character offset. Line and column are 1-based and
 * derived from the same offset for display.</p>
 */
public final class JsonParseException extends TranscodeException
{
    public enum Kind {
        /** Malformed syntax: unexpected token, unterminated string, trailing comma and the like. */
        SYNTAX_ERROR,
        /** Unknown escape letter, malformed {@code \\u} sequence or unpaired surrogate. */
        INVALID_ESCAPE,
        /** Non-whitespace content after the single top-level value. */
        TRAILING_DATA,
        /** Nesting deeper than the configured maximum. */
        DEPTH_EXCEEDED
    }

    private final Kind kind;
    private final int line;
    private final int column;

    public JsonParseException(Kind kind, long offset, int line, int column, String message) {
        super(message, offset, null);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.line = line;
        this.column = column;
    }

    public Kind kind() {
        return kind;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    @Override
    public String kindName() {
        return label(kind);
    }

    @Override
    public String describe() {
        if (!hasPosition()) {
            return super.describe();
        }
        return kindName() + " at offset " + position()
                + " (line " + line + ", column " + column + "): " + getMessage();
    }
}
