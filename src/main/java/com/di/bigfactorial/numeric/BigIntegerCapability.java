package com.di.bigfactorial.numeric;

import java.math.BigInteger;

/**
 * Arbitrary-precision arithmetic backed by {@link BigInteger}. This is the
 * type the service and the CLI compute with.
 */
public final class BigIntegerCapability implements NumericCapability<BigInteger> {

    public static final BigIntegerCapability INSTANCE = new BigIntegerCapability();

    private static final BigInteger TWO_POW_64 = BigInteger.ONE.shiftLeft(64);

    private BigIntegerCapability() {
    }

    @Override
    public BigInteger fromUnsigned(long value) {
        BigInteger v = BigInteger.valueOf(value);
        return value >= 0 ? v : v.add(TWO_POW_64);
    }

    @Override
    public BigInteger multiply(BigInteger left, BigInteger right) {
        return left.multiply(right);
    }

    @Override
    public BigInteger one() {
        return BigInteger.ONE;
    }

    @Override
    public String name() {
        return "bigint";
    }
}
