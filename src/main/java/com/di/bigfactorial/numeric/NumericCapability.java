package com.di.bigfactorial.numeric;

/**
 * Minimal arithmetic a numeric type must offer to take part in a factorial
 * reduction: construction from an unsigned 64-bit value and multiplication.
 *
 * <p>Implementations must satisfy:
 * <ul>
 *   <li>{@code multiply} is associative and commutative,</li>
 *   <li>{@code one()} is a left and right identity of {@code multiply},</li>
 *   <li>values of {@code T} are immutable, so a worker thread can hand a
 *       partial product to the orchestrator without further synchronisation.</li>
 * </ul>
 * Partial products are folded in completion order, not window order, so the
 * first two rules are what makes the result deterministic.
 *
 * @param <T> the numeric value type
 */
public interface NumericCapability<T> {

    /**
     * Builds a value from {@code value}, read as an unsigned 64-bit integer.
     */
    T fromUnsigned(long value);

    /** Returns {@code left * right}. */
    T multiply(T left, T right);

    /** The multiplicative identity. */
    default T one() {
        return fromUnsigned(1L);
    }

    /** Short name used in log lines and metric tags. */
    String name();
}
