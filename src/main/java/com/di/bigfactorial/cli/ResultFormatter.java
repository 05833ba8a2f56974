package com.di.bigfactorial.cli;

import java.math.BigInteger;

/**
 * Renders a factorial either in full or as {@code mantissa*2^exponent}.
 */
public final class ResultFormatter {

    // bits of precision in a double's significand, hidden bit included
    private static final int SIGNIFICAND_BITS = 53;

    private ResultFormatter() {
    }

    public static String format(long x, BigInteger value, boolean fullOutput) {
        return x + "! = " + (fullOutput ? value.toString() : scientific(value));
    }

    /**
     * {@code m*2^e} with {@code 1 <= m < 2} and {@code e = bitLength - 1}.
     * The mantissa keeps the leading 53 bits of {@code value}, rounded toward zero,
     * and a whole mantissa prints without a fraction ({@code 1*2^0}).
     *
     * @throws IllegalArgumentException for values below 1
     */
    static String scientific(BigInteger value) {
        if (value.signum() <= 0) {
            throw new IllegalArgumentException("value must be positive, got " + value);
        }
        int exponent = value.bitLength() - 1;
        int shift = Math.max(0, exponent - (SIGNIFICAND_BITS - 1));
        long leading = value.shiftRight(shift).longValueExact();
        double mantissa = Math.scalb((double) leading, -(exponent - shift));
        String digits = mantissa == 1.0 ? "1" : Double.toString(mantissa);
        return digits + "*2^" + exponent;
    }
}
