package com.questrail.cbd.model;

/**
 * 64-bit floating point value.
 *
 * <p>Half and single precision CBOR floats are widened to double on decode.
 * Equality follows {@link Double#compare}, so {@code NaN} equals itself and
 * {@code 0.0} differs from {@code -0.0}.</p>
 */
public record FloatValue(double value) implements Value
{
    @Override
    public String toString() {
        return Double.toString(value);
    }
}
