package com.di.bigfactorial.reduce;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a windowed reduction together with what it took to get there.
 */
@Value
@Builder
public class ReductionOutcome<T> {

    /** Correlation id, also present as {@code runId} in the MDC of every log line of the run. */
    String runId;

    T value;

    long n;

    int concurrency;

    long windowSize;

    /** Distinct windows issued; re-dispatches are counted separately. */
    long windowsDispatched;

    long windowsFolded;

    long redispatches;

    /** Completion messages ignored because their window was no longer in flight. */
    long discardedMessages;

    /** Largest in-flight set size observed; never exceeds {@link #concurrency}. */
    int peakInFlight;

    long elapsedMs;
}
