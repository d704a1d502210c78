package com.questrail.cbd.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Integer value of arbitrary precision.
 *
 * <p>Kept distinct from {@link FloatValue} because CBOR encodes the two with
 * different major types and JSON prints integers without a decimal point.</p>
 *
 * <p>The model itself does not bound the magnitude. The CBOR encoder accepts
 * only the range CBOR major types 0 and 1 can carry,
 * {@link #CBOR_MIN} through {@link #CBOR_MAX}; JSON has no such limit.</p>
 */
public record IntegerValue(BigInteger value) implements Value
{
    /** Largest integer representable by CBOR major type 0: 2^64 - 1. */
    public static final BigInteger CBOR_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    /** Smallest integer representable by CBOR major type 1: -2^64. */
    public static final BigInteger CBOR_MIN = BigInteger.ONE.shiftLeft(64).negate();

    public IntegerValue {
        Objects.requireNonNull(value, "value");
    }

    public static IntegerValue of(long value) {
        return new IntegerValue(BigInteger.valueOf(value));
    }

    /**
     * Returns true if this integer fits the CBOR integer range.
     */
    public boolean fitsCbor() {
        return value.compareTo(CBOR_MIN) >= 0 && value.compareTo(CBOR_MAX) <= 0;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
