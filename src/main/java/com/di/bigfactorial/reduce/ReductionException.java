package com.di.bigfactorial.reduce;

/**
 * Base class for failures that abort a windowed reduction.
 */
public class ReductionException extends RuntimeException {

    public ReductionException(String message) {
        super(message);
    }

    public ReductionException(String message, Throwable cause) {
        super(message, cause);
    }
}
