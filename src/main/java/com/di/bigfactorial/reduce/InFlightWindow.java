package com.di.bigfactorial.reduce;

import com.di.bigfactorial.window.Window;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.concurrent.Future;

/**
 * Book-keeping for a dispatched window that has not been folded yet.
 * Only the current attempt is tracked; superseded attempts are abandoned.
 */
@Data
@AllArgsConstructor
class InFlightWindow {

    private final Window window;

    private int attempt;

    /** {@link System#nanoTime()} at which the current attempt was submitted. */
    private long dispatchedAtNanos;

    private Future<?> future;
}
