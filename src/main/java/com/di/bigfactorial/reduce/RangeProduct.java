package com.di.bigfactorial.reduce;

import com.di.bigfactorial.numeric.NumericCapability;

/**
 * Inclusive product of the integers in {@code [from, to]}.
 *
 * <p>Pure and stateless apart from the capability it multiplies with, so one
 * instance is shared by every worker of a reduction.
 */
public final class RangeProduct<T> {

    private final NumericCapability<T> capability;

    public RangeProduct(NumericCapability<T> capability) {
        this.capability = capability;
    }

    /**
     * Returns {@code from * (from+1) * ... * to}, folded left in ascending
     * order starting from the identity. An empty range ({@code from > to})
     * yields the identity.
     */
    public T product(long from, long to) {
        T acc = capability.one();
        if (from > to) {
            return acc;
        }
        for (long x = from; ; x++) {
            acc = capability.multiply(acc, capability.fromUnsigned(x));
            // x == to before x++ so to == Long.MAX_VALUE does not wrap
            if (x == to) break;
        }
        return acc;
    }
}
