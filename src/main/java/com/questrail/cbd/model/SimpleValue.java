package com.questrail.cbd.model;

/**
 * CBOR simple value (major type 7) with no dedicated variant.
 *
 * <p>Covers {@code undefined} (code 23) and the unassigned or reserved
 * codes. {@code false}, {@code true} and {@code null} decode to
 * {@link BoolValue} and {@link NullValue} instead, so codes 20-22 are
 * rejected here, as are the reserved codes 24-31.</p>
 */
public record SimpleValue(int code) implements Value
{
    public static final int UNDEFINED = 23;

    private static final int FALSE_CODE = 20;
    private static final int NULL_CODE = 22;
    private static final int MIN_ONE_BYTE_CODE = 32;

    public SimpleValue {
        if (code < 0 || code > 0xFF) {
            throw new IllegalArgumentException("Simple value code must be in range 0-255 (was " + code + ")");
        }
        if (code >= FALSE_CODE && code <= NULL_CODE) {
            throw new IllegalArgumentException("Simple value " + code + " is false, true or null; use BoolValue or NullValue");
        }
        if (code > UNDEFINED && code < MIN_ONE_BYTE_CODE) {
            throw new IllegalArgumentException("Simple value " + code + " is reserved and has no well-formed encoding");
        }
    }

    public boolean isUndefined() {
        return code == UNDEFINED;
    }

    @Override
    public String toString() {
        return isUndefined() ? "undefined" : "simple(" + code + ")";
    }
}
