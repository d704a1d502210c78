package com.questrail.cbd.codec.impl;

/**
 * A syntactically significant element of JSON text, identified by the
 * character it starts with.
 */
enum JsonToken
{
    END_TEXT,
    NULL,
    FALSE,
    TRUE,
    NUMBER,
    START_OBJECT,
    END_OBJECT,
    START_ARRAY,
    END_ARRAY,

    /**
     * Member name or string value; not distinguished at the token level.
     */
    STRING,

    COMMA,
    COLON,
    WHITESPACE,

    ERROR;

    /**
     * @param c a UTF-16 char, or {@code -1} at end of text
     */
    static JsonToken startingWith(int c)
    {
        return switch (c) {
            case -1 -> END_TEXT;
            case 'n' -> NULL;
            case 'f' -> FALSE;
            case 't' -> TRUE;
            case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', '-' -> NUMBER;
            case '{' -> START_OBJECT;
            case '}' -> END_OBJECT;
            case '[' -> START_ARRAY;
            case ']' -> END_ARRAY;
            case '"' -> STRING;
            case ',' -> COMMA;
            case ':' -> COLON;
            case 0x20, 0x0A, 0x0D, 0x09 -> WHITESPACE;
            default -> ERROR;
        };
    }

    /**
     * Spelling of the three literal tokens.
     */
    String literal()
    {
        return switch (this) {
            case NULL -> "null";
            case FALSE -> "false";
            case TRUE -> "true";
            default -> throw new IllegalStateException("Token has no literal spelling: " + this);
        };
    }
}
