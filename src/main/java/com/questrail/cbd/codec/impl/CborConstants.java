package com.questrail.cbd.codec.impl;

/**
 * CborConstants
 * -----------------------------------------------------------------------------
 * Initial-byte layout of RFC 8949 (section 3).
 *
 * <p>Every CBOR data item starts with one byte: the top three bits select the
 * <em>major type</em>, the bottom five bits are the <em>additional info</em>.
 * Additional info 0-23 is the argument itself; 24-27 announce a 1, 2, 4 or
 * 8 byte big-endian argument; 28-30 are reserved; 31 marks indefinite
 * length (or, under major type 7, the break stop code).</p>
 */
final class CborConstants
{
    static final int MAJOR_UNSIGNED = 0;
    static final int MAJOR_NEGATIVE = 1;
    static final int MAJOR_BYTE_STRING = 2;
    static final int MAJOR_TEXT_STRING = 3;
    static final int MAJOR_ARRAY = 4;
    static final int MAJOR_MAP = 5;
    static final int MAJOR_TAG = 6;
    static final int MAJOR_SIMPLE = 7;

    /** Largest argument embedded directly in the additional info. */
    static final int MAX_EMBEDDED = 23;

    static final int ONE_BYTE = 24;
    static final int TWO_BYTES = 25;
    static final int FOUR_BYTES = 26;
    static final int EIGHT_BYTES = 27;
    static final int INDEFINITE = 31;

    // Major type 7 additional info values
    static final int SIMPLE_FALSE = 20;
    static final int SIMPLE_TRUE = 21;
    static final int SIMPLE_NULL = 22;
    static final int SIMPLE_UNDEFINED = 23;
    static final int SIMPLE_ONE_BYTE = 24;
    static final int HALF_FLOAT = 25;
    static final int SINGLE_FLOAT = 26;
    static final int DOUBLE_FLOAT = 27;

    /** One-byte simple codes below this value are not well-formed (RFC 8949 section 3.3). */
    static final int MIN_ONE_BYTE_SIMPLE = 32;

    /** The break stop code: major type 7, additional info 31. */
    static final int BREAK = 0xFF;

    private CborConstants() {}

    static int majorType(int initialByte) {
        return (initialByte >>> 5) & 0x07;
    }

    static int additionalInfo(int initialByte) {
        return initialByte & 0x1F;
    }

    static int initialByte(int majorType, int additionalInfo) {
        return (majorType << 5) | additionalInfo;
    }

    static String majorTypeName(int majorType) {
        return switch (majorType) {
            case MAJOR_UNSIGNED -> "unsigned integer";
            case MAJOR_NEGATIVE -> "negative integer";
            case MAJOR_BYTE_STRING -> "byte string";
            case MAJOR_TEXT_STRING -> "text string";
            case MAJOR_ARRAY -> "array";
            case MAJOR_MAP -> "map";
            case MAJOR_TAG -> "tag";
            default -> "simple/float";
        };
    }
}
