package com.di.bigfactorial.reduce;

import com.di.bigfactorial.window.Window;
import lombok.Getter;

/**
 * Thrown when a worker reports an exception while multiplying a window.
 * Window products are deterministic, so the window is not retried.
 */
@Getter
public class WindowFailedException extends ReductionException {

    private final transient Window window;
    private final int attempt;

    public WindowFailedException(Window window, int attempt, Throwable cause) {
        super(String.format("Window %s failed on attempt %d: %s", window, attempt, cause.getMessage()), cause);
        this.window = window;
        this.attempt = attempt;
    }
}
