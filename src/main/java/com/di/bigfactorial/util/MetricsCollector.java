package com.di.bigfactorial.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for windowed factorial reductions.
 * Tracks window traffic, supervision activity and reduction outcomes.
 */
@Slf4j
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    // Window Metrics
    private final Counter windowsDispatchedCounter;
    private final Counter windowsFoldedCounter;
    private final Counter windowsRedispatchedCounter;
    private final Counter messagesDiscardedCounter;
    private final DistributionSummary inFlightDistribution;

    // Reduction Metrics
    private final Counter reductionCounter;
    private final Counter reductionErrorCounter;
    private final Timer reductionTimer;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.windowsDispatchedCounter = Counter.builder("reduction.windows.dispatched")
                .description("Distinct windows handed to the worker pool")
                .register(meterRegistry);

        this.windowsFoldedCounter = Counter.builder("reduction.windows.folded")
                .description("Partial products folded into an accumulator")
                .register(meterRegistry);

        this.windowsRedispatchedCounter = Counter.builder("reduction.windows.redispatched")
                .description("Replacement attempts issued for timed-out windows")
                .register(meterRegistry);

        this.messagesDiscardedCounter = Counter.builder("reduction.messages.discarded")
                .description("Completion messages for windows no longer in flight")
                .register(meterRegistry);

        this.inFlightDistribution = DistributionSummary.builder("reduction.windows.inflight")
                .description("In-flight window count observed after each dispatch")
                .baseUnit("windows")
                .register(meterRegistry);

        this.reductionCounter = Counter.builder("reduction.total")
                .description("Total number of completed reductions")
                .tag("status", "success")
                .register(meterRegistry);

        this.reductionErrorCounter = Counter.builder("reduction.total")
                .description("Total number of failed reductions")
                .tag("status", "error")
                .register(meterRegistry);

        this.reductionTimer = Timer.builder("reduction.duration")
                .description("Wall-clock time of a reduction")
                .register(meterRegistry);
    }

    // ============================================================================
    // Window Metrics
    // ============================================================================

    /**
     * Records a window's first dispatch; re-dispatches are counted by {@link #recordWindowRedispatched()}.
     *
     * @param inFlight in-flight window count after the dispatch
     */
    public void recordWindowDispatched(int inFlight) {
        windowsDispatchedCounter.increment();
        inFlightDistribution.record(inFlight);
    }

    public void recordWindowFolded() {
        windowsFoldedCounter.increment();
    }

    public void recordWindowRedispatched() {
        windowsRedispatchedCounter.increment();
    }

    public void recordMessageDiscarded() {
        messagesDiscardedCounter.increment();
    }

    // ============================================================================
    // Reduction Metrics
    // ============================================================================

    /**
     * Records a reduction that produced a value.
     *
     * @param durationMs wall-clock time in milliseconds
     */
    public void recordReduction(long durationMs) {
        reductionCounter.increment();
        reductionTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded reduction: durationMs={}", durationMs);
    }

    /**
     * Records a reduction that ended with an exception.
     *
     * @param errorType simple name of the exception class
     */
    public void recordReductionError(String errorType) {
        reductionErrorCounter.increment();
        Counter.builder("reduction.errors.by.type")
                .description("Failed reductions by exception type")
                .tag("error.type", errorType)
                .register(meterRegistry)
                .increment();
        log.debug("Recorded reduction error: type={}", errorType);
    }
}
