package com.di.bigfactorial.reduce;

import com.di.bigfactorial.config.ReductionProperties;
import com.di.bigfactorial.numeric.NumericCapability;
import com.di.bigfactorial.util.MdcPropagation;
import com.di.bigfactorial.util.MetricsCollector;
import com.di.bigfactorial.window.Window;
import com.di.bigfactorial.window.WindowPartitioner;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Multiplies {@code [1, n]} window by window on a bounded worker pool and
 * folds the partial products into one value.
 *
 * <h3>Scheduling loop</h3>
 * <pre>
 *   state = (nextStart = 1, inFlight = {}, acc = 1)
 *   while windows remain or inFlight is not empty:
 *     dispatch:  while windows remain and |inFlight| &lt; concurrency
 *                  submit RangeProduct(nextStart, min(n, nextStart + W - 1))
 *     collect:   wait (bounded by poll-interval) for one CompletionMessage;
 *                fold it if its window is still in flight, else discard
 *     supervise: re-dispatch every window whose current attempt is older
 *                than window-timeout; fail once max-redispatches is spent
 * </pre>
 *
 * <h3>Concurrency</h3>
 * At most {@code concurrency} windows are in flight at any instant. Windows are
 * issued in ascending order but folded in completion order, which the
 * {@link NumericCapability} contract (associative, commutative) makes safe.
 * The in-flight set and accumulator live in a {@link ReductionState} local to
 * each call; workers only ever touch the {@link CompletionChannel}.
 *
 * <h3>Worker pool</h3>
 * One pool per reduction with {@code concurrency} core threads and a direct
 * hand-off queue. A re-dispatched attempt gets its own thread instead of
 * queueing behind the abandoned one. The pool has no thread cap: the in-flight
 * set bounds live windows, and an abandoned attempt that ignores cancellation
 * keeps its thread until it returns.
 */
@Slf4j
public class WindowedReducer<T> {

    public static final int MIN_CONCURRENCY = 1;
    public static final int MAX_CONCURRENCY = 255;

    private static final String MDC_RUN_ID = "runId";

    private final NumericCapability<T> capability;
    private final RangeProduct<T> rangeProduct;
    private final ReductionProperties properties;
    private final WindowPartitioner partitioner;
    private final MetricsCollector metrics;
    private final Supplier<CompletionChannel<T>> channelFactory;

    public WindowedReducer(NumericCapability<T> capability,
                           ReductionProperties properties,
                           MetricsCollector metrics) {
        this(capability, properties, metrics, CompletionChannel::new);
    }

    WindowedReducer(NumericCapability<T> capability,
                    ReductionProperties properties,
                    MetricsCollector metrics,
                    Supplier<CompletionChannel<T>> channelFactory) {
        properties.validate();
        this.capability = capability;
        this.rangeProduct = new RangeProduct<>(capability);
        this.properties = properties;
        this.partitioner = new WindowPartitioner(properties.getWindowSize());
        this.metrics = metrics;
        this.channelFactory = channelFactory;
    }

    /* ------------------------------------------------------------------ */
    /* Public API                                                           */
    /* ------------------------------------------------------------------ */

    /**
     * Returns {@code n!} computed with at most {@code concurrency} windows in flight.
     *
     * @throws IllegalArgumentException if {@code n < 0} or {@code concurrency} is outside [1, 255]
     * @throws WindowFailedException    if a worker throws while multiplying a window
     * @throws WindowTimeoutException   if a window exhausts its re-dispatches
     */
    public T reduce(long n, int concurrency) {
        return reduceWithOutcome(n, concurrency).getValue();
    }

    /**
     * Same as {@link #reduce(long, int)} but also reports window traffic and timing.
     */
    public ReductionOutcome<T> reduceWithOutcome(long n, int concurrency) {
        validate(n, concurrency);

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        long startNanos = System.nanoTime();
        ThreadPoolExecutor pool = newWorkerPool(concurrency);

        log.info("[REDUCE] start n={} concurrency={} windowSize={} windows={} type={}",
                 n, concurrency, partitioner.getWindowSize(), partitioner.count(n), capability.name());
        try {
            ReductionState<T> state = runLoop(n, concurrency, pool);
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
            metrics.recordReduction(elapsedMs);

            log.info("[REDUCE] done n={} windows={} redispatches={} discarded={} peakInFlight={} duration={}ms",
                     n, state.windowsFolded(), state.redispatches(), state.discardedMessages(),
                     state.peakInFlight(), elapsedMs);

            return ReductionOutcome.<T>builder()
                    .runId(runId)
                    .value(state.accumulator())
                    .n(n)
                    .concurrency(concurrency)
                    .windowSize(partitioner.getWindowSize())
                    .windowsDispatched(state.windowsDispatched())
                    .windowsFolded(state.windowsFolded())
                    .redispatches(state.redispatches())
                    .discardedMessages(state.discardedMessages())
                    .peakInFlight(state.peakInFlight())
                    .elapsedMs(elapsedMs)
                    .build();
        } catch (RuntimeException ex) {
            metrics.recordReductionError(ex.getClass().getSimpleName());
            throw ex;
        } finally {
            pool.shutdownNow();
            MDC.remove(MDC_RUN_ID);
        }
    }

    /* ------------------------------------------------------------------ */
    /* Private: scheduling loop                                             */
    /* ------------------------------------------------------------------ */

    private ReductionState<T> runLoop(long n, int concurrency, ExecutorService pool) {
        CompletionChannel<T> channel = channelFactory.get();
        ReductionState<T> state = new ReductionState<>(capability);
        Duration pollInterval = properties.getPollInterval();
        long timeoutNanos = properties.getWindowTimeout().toNanos();

        long nextStart = 1;
        boolean allIssued = n < 1;

        while (!allIssued || state.hasInFlight()) {
            // ── dispatch ─────────────────────────────────────────────────
            while (!allIssued && state.inFlightCount() < concurrency) {
                Window window = partitioner.next(nextStart, n);
                Future<?> future = submit(pool, channel, window, 1);
                state.markDispatched(window, future, System.nanoTime());
                metrics.recordWindowDispatched(state.inFlightCount());
                log.debug("[REDUCE] dispatched window {} inFlight={}", window, state.inFlightCount());

                if (window.getEnd() == n) {
                    allIssued = true;
                } else {
                    nextStart = window.getEnd() + 1;
                }
            }

            // ── collect ──────────────────────────────────────────────────
            CompletionMessage<T> message;
            try {
                message = channel.poll(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReductionException(String.format(
                        "Reduction interrupted with %d window(s) in flight", state.inFlightCount()), e);
            }
            if (message != null) {
                collect(state, message);
            }

            // ── supervise ────────────────────────────────────────────────
            supervise(state, pool, channel, timeoutNanos);
        }
        return state;
    }

    private void collect(ReductionState<T> state, CompletionMessage<T> message) {
        InFlightWindow entry = state.get(message.getWindowStart());
        switch (state.receive(message)) {
            case FOLDED:
                metrics.recordWindowFolded();
                log.debug("[REDUCE] folded window starting at {} (attempt {})",
                          message.getWindowStart(), message.getAttempt());
                break;
            case DISCARDED:
                metrics.recordMessageDiscarded();
                log.debug("[REDUCE] discarded message for window starting at {} (attempt {})",
                          message.getWindowStart(), message.getAttempt());
                break;
            case FAILED:
                throw new WindowFailedException(entry.getWindow(), message.getAttempt(), message.getFailure());
            default:
                throw new IllegalStateException("Unhandled receipt for window " + message.getWindowStart());
        }
    }

    private void supervise(ReductionState<T> state, ExecutorService pool,
                           CompletionChannel<T> channel, long timeoutNanos) {
        long now = System.nanoTime();
        for (InFlightWindow stale : state.staleWindows(now, timeoutNanos)) {
            Window window = stale.getWindow();
            if (stale.getAttempt() > properties.getMaxRedispatches()) {
                throw new WindowTimeoutException(window, stale.getAttempt(), properties.getWindowTimeout());
            }
            stale.getFuture().cancel(true);
            int attempt = stale.getAttempt() + 1;
            Future<?> future = submit(pool, channel, window, attempt);
            state.redispatch(window.getStart(), future, now);
            metrics.recordWindowRedispatched();
            log.warn("[SUPERVISE] window {} exceeded {}ms on attempt {}, re-dispatched as attempt {}",
                     window, properties.getWindowTimeout().toMillis(), attempt - 1, attempt);
        }
    }

    /* ------------------------------------------------------------------ */
    /* Private: workers                                                     */
    /* ------------------------------------------------------------------ */

    private Future<?> submit(ExecutorService pool, CompletionChannel<T> channel, Window window, int attempt) {
        return pool.submit(MdcPropagation.wrapRunnable(() -> {
            long t0 = System.nanoTime();
            CompletionMessage<T> message;
            try {
                T partial = rangeProduct.product(window.getStart(), window.getEnd());
                message = CompletionMessage.success(window.getStart(), attempt, partial);
                log.debug("[WINDOW] {} attempt={} done in {}ms",
                          window, attempt, (System.nanoTime() - t0) / 1_000_000L);
            } catch (Throwable ex) {
                // an Error must reach the orchestrator too
                log.warn("[WINDOW] {} attempt={} failed: {}", window, attempt, ex.toString());
                message = CompletionMessage.failure(window.getStart(), attempt, ex);
            }
            channel.send(message);
        }));
    }

    private ThreadPoolExecutor newWorkerPool(int concurrency) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            var t = new Thread(r, "factorial-window-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return new ThreadPoolExecutor(concurrency, Integer.MAX_VALUE, 30L, TimeUnit.SECONDS,
                                      new SynchronousQueue<>(), tf);
    }

    private static void validate(long n, int concurrency) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative, got " + n);
        }
        if (concurrency < MIN_CONCURRENCY || concurrency > MAX_CONCURRENCY) {
            throw new IllegalArgumentException(String.format(
                    "concurrency must be between %d and %d, got %d",
                    MIN_CONCURRENCY, MAX_CONCURRENCY, concurrency));
        }
    }
}
