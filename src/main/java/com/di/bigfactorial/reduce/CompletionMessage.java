package com.di.bigfactorial.reduce;

import lombok.Value;

/**
 * What a worker attempt reports back to the orchestrator: either the window's
 * partial product or the exception that stopped it.
 */
@Value
public class CompletionMessage<T> {

    long windowStart;

    /** 1 for the first dispatch of a window, incremented per re-dispatch. */
    int attempt;

    /** Non-null on success. */
    T partialProduct;

    /** Non-null on failure. */
    Throwable failure;

    public static <T> CompletionMessage<T> success(long windowStart, int attempt, T partialProduct) {
        return new CompletionMessage<>(windowStart, attempt, partialProduct, null);
    }

    public static <T> CompletionMessage<T> failure(long windowStart, int attempt, Throwable failure) {
        return new CompletionMessage<>(windowStart, attempt, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
