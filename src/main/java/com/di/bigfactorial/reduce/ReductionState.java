package com.di.bigfactorial.reduce;

import com.di.bigfactorial.numeric.NumericCapability;
import com.di.bigfactorial.window.Window;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * The orchestrator's private state: the in-flight set keyed by window start
 * and the running accumulator.
 *
 * <p>Not thread-safe. An instance is created inside one
 * {@link WindowedReducer#reduceWithOutcome} call and is never handed to a
 * worker; workers reach the orchestrator only through the
 * {@link CompletionChannel}.
 */
class ReductionState<T> {

    /** What {@link #receive} did with a message. */
    enum Receipt {
        /** Window removed from the in-flight set, product folded in. */
        FOLDED,
        /** Window not in flight, or message from a superseded attempt. */
        DISCARDED,
        /** Current attempt of an in-flight window failed. */
        FAILED
    }

    private final NumericCapability<T> capability;
    private final Map<Long, InFlightWindow> inFlight = new LinkedHashMap<>();
    private T accumulator;

    private long windowsDispatched;
    private long windowsFolded;
    private long redispatches;
    private long discardedMessages;
    private int peakInFlight;

    ReductionState(NumericCapability<T> capability) {
        this.capability = capability;
        this.accumulator = capability.one();
    }

    /**
     * Records the first attempt of {@code window}.
     *
     * @throws IllegalStateException if a window with the same start is already in flight
     */
    void markDispatched(Window window, Future<?> future, long nowNanos) {
        if (inFlight.containsKey(window.getStart())) {
            throw new IllegalStateException("Window " + window + " is already in flight");
        }
        inFlight.put(window.getStart(), new InFlightWindow(window, 1, nowNanos, future));
        windowsDispatched++;
        peakInFlight = Math.max(peakInFlight, inFlight.size());
    }

    /**
     * Replaces the current attempt of the in-flight window at {@code start}
     * with a new one.
     *
     * @return the new attempt number
     */
    int redispatch(long start, Future<?> future, long nowNanos) {
        InFlightWindow entry = inFlight.get(start);
        if (entry == null) {
            throw new IllegalStateException("Window starting at " + start + " is not in flight");
        }
        entry.setAttempt(entry.getAttempt() + 1);
        entry.setDispatchedAtNanos(nowNanos);
        entry.setFuture(future);
        redispatches++;
        return entry.getAttempt();
    }

    /**
     * Applies one completion message. A success for an in-flight window is
     * folded exactly once, whichever attempt produced it; every later message
     * for that window is discarded.
     */
    Receipt receive(CompletionMessage<T> message) {
        InFlightWindow entry = inFlight.get(message.getWindowStart());
        if (entry == null) {
            discardedMessages++;
            return Receipt.DISCARDED;
        }
        if (!message.isSuccess()) {
            if (message.getAttempt() != entry.getAttempt()) {
                discardedMessages++;
                return Receipt.DISCARDED;
            }
            return Receipt.FAILED;
        }
        inFlight.remove(message.getWindowStart());
        accumulator = capability.multiply(accumulator, message.getPartialProduct());
        windowsFolded++;
        return Receipt.FOLDED;
    }

    /** In-flight windows whose current attempt was submitted at least {@code timeoutNanos} ago. */
    List<InFlightWindow> staleWindows(long nowNanos, long timeoutNanos) {
        List<InFlightWindow> stale = new ArrayList<>();
        for (InFlightWindow entry : inFlight.values()) {
            if (nowNanos - entry.getDispatchedAtNanos() >= timeoutNanos) {
                stale.add(entry);
            }
        }
        return stale;
    }

    InFlightWindow get(long start) {
        return inFlight.get(start);
    }

    boolean hasInFlight() {
        return !inFlight.isEmpty();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    T accumulator() {
        return accumulator;
    }

    long windowsDispatched() {
        return windowsDispatched;
    }

    long windowsFolded() {
        return windowsFolded;
    }

    long redispatches() {
        return redispatches;
    }

    long discardedMessages() {
        return discardedMessages;
    }

    int peakInFlight() {
        return peakInFlight;
    }
}
