package com.di.bigfactorial.reduce;

import com.di.bigfactorial.window.Window;
import lombok.Getter;

import java.time.Duration;

/**
 * Thrown when a window's last allowed attempt exceeds the window timeout.
 */
@Getter
public class WindowTimeoutException extends ReductionException {

    private final transient Window window;
    private final int attempts;

    public WindowTimeoutException(Window window, int attempts, Duration timeout) {
        super(String.format("Window %s did not complete after %d attempt(s) of %dms each",
                window, attempts, timeout.toMillis()));
        this.window = window;
        this.attempts = attempts;
    }
}
