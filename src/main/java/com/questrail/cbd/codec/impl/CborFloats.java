package com.questrail.cbd.codec.impl;

/**
 * Conversion of IEEE 754 half-precision bit patterns, which Java has no
 * primitive for.
 */
final class CborFloats
{
    private CborFloats() {}

    /**
     * Widens a 16-bit half-precision value to double. Exact for every input,
     * including subnormals, infinities and NaN (RFC 8949 appendix D).
     *
     * @param half the half-precision bits in the low 16 bits
     */
    static double halfToDouble(int half)
    {
        final int exponent = (half >>> 10) & 0x1F;
        final int mantissa = half & 0x3FF;

        final double magnitude;
        if (exponent == 0) {
            magnitude = Math.scalb((double) mantissa, -24);
        }
        else if (exponent != 0x1F) {
            magnitude = Math.scalb((double) (mantissa + 1024), exponent - 25);
        }
        else {
            magnitude = (mantissa == 0) ? Double.POSITIVE_INFINITY : Double.NaN;
        }

        return ((half & 0x8000) != 0) ? -magnitude : magnitude;
    }
}
