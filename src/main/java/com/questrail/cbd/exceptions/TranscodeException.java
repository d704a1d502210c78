package com.questrail.cbd.exceptions;

/**
 * TranscodeException
 * -----------------------------------------------------------------------------
 * Root of every failure a transcode can report.
 *
 * <p>Every error is terminal for the invocation: components below the
 * pipeline throw one of the permitted subclasses and never print, retry or
 * exit on their own. The pipeline decides how a failure is presented.</p>
 *
 * <p>Each subclass carries a kind (its own enum) and, where the failing
 * component knows it, the position in the input at which the problem was
 * detected. Positions are byte offsets for binary input and character
 * offsets for text input; {@code -1} means unknown.</p>
 */
public sealed abstract class TranscodeException extends RuntimeException
        permits CborDecodeException, CborEncodeException, JsonParseException,
                JsonPrintException, Base64Exception, TranscodeIoException
{
    public static final long NO_POSITION = -1;

    private final long position;

    protected TranscodeException(String message, long position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /**
     * Returns the input offset where the failure was detected, or {@link #NO_POSITION}.
     */
    public long position() {
        return position;
    }

    public boolean hasPosition() {
        return position >= 0;
    }

    /**
     * Returns the error kind in the form shown to users, e.g. {@code UnexpectedEof}.
     */
    public abstract String kindName();

    /**
     * Returns a one-line description: kind, position (when known) and detail.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kindName());
        if (hasPosition()) {
            sb.append(" at offset ").append(position);
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }

    static String label(Enum<?> kind) {
        StringBuilder sb = new StringBuilder();
        for (String part : kind.name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
