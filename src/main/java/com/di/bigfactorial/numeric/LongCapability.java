package com.di.bigfactorial.numeric;

/**
 * Fixed-width 64-bit arithmetic. Overflow is trapped: {@link #multiply}
 * throws {@link ArithmeticException} instead of wrapping, so the largest
 * factorial it can hold is {@code 20!}.
 */
public final class LongCapability implements NumericCapability<Long> {

    public static final LongCapability INSTANCE = new LongCapability();

    private LongCapability() {
    }

    /**
     * @throws ArithmeticException if {@code value} is above {@link Long#MAX_VALUE} when read unsigned
     */
    @Override
    public Long fromUnsigned(long value) {
        if (value < 0) {
            throw new ArithmeticException(
                    "Unsigned value " + Long.toUnsignedString(value) + " does not fit in a signed long");
        }
        return value;
    }

    @Override
    public Long multiply(Long left, Long right) {
        return Math.multiplyExact(left, right);
    }

    @Override
    public Long one() {
        return 1L;
    }

    @Override
    public String name() {
        return "long";
    }
}
