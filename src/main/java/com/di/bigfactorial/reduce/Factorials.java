package com.di.bigfactorial.reduce;

import com.di.bigfactorial.numeric.NumericCapability;

/**
 * Single-threaded factorial. Serves as the baseline and as the oracle the
 * windowed reduction is checked against.
 */
public final class Factorials {

    private Factorials() {
    }

    /**
     * Returns {@code n!} computed as {@code RangeProduct(1, n)}.
     *
     * @throws IllegalArgumentException if {@code n < 0}
     */
    public static <T> T factorial(NumericCapability<T> capability, long n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative, got " + n);
        }
        return new RangeProduct<>(capability).product(1, n);
    }
}
