package com.di.bigfactorial.reduce;

import com.di.bigfactorial.numeric.LongCapability;
import com.di.bigfactorial.window.Window;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReductionState Tests")
class ReductionStateTest {

    private ReductionState<Long> state;

    @BeforeEach
    void setUp() {
        state = new ReductionState<>(LongCapability.INSTANCE);
    }

    private static Window window(long start, long end) {
        return Window.builder().start(start).end(end).build();
    }

    @Test
    @DisplayName("Starts with identity accumulator and empty in-flight set")
    void testInitialState() {
        assertEquals(1L, state.accumulator());
        assertFalse(state.hasInFlight());
        assertEquals(0, state.peakInFlight());
    }

    @Test
    @DisplayName("Duplicate completion for a folded window leaves the accumulator unchanged")
    void testReceive_DuplicateIsIgnored() {
        state.markDispatched(window(1, 3), new CompletableFuture<>(), 0L);
        CompletionMessage<Long> msg = CompletionMessage.success(1, 1, 6L);

        assertEquals(ReductionState.Receipt.FOLDED, state.receive(msg));
        assertEquals(6L, state.accumulator());

        assertEquals(ReductionState.Receipt.DISCARDED, state.receive(msg));
        assertEquals(6L, state.accumulator());
        assertEquals(1, state.windowsFolded());
        assertEquals(1, state.discardedMessages());
    }

    @Test
    @DisplayName("Message for a window never dispatched is discarded")
    void testReceive_UnknownWindow() {
        assertEquals(ReductionState.Receipt.DISCARDED,
            state.receive(CompletionMessage.success(42, 1, 99L)));
        assertEquals(1L, state.accumulator());
    }

    @Test
    @DisplayName("Folds windows in any order to the same product")
    void testReceive_OutOfOrder() {
        state.markDispatched(window(1, 2), new CompletableFuture<>(), 0L);
        state.markDispatched(window(3, 4), new CompletableFuture<>(), 0L);
        state.markDispatched(window(5, 5), new CompletableFuture<>(), 0L);
        assertEquals(3, state.peakInFlight());

        state.receive(CompletionMessage.success(5, 1, 5L));
        state.receive(CompletionMessage.success(1, 1, 2L));
        state.receive(CompletionMessage.success(3, 1, 12L));

        assertEquals(120L, state.accumulator());
        assertFalse(state.hasInFlight());
    }

    @Test
    @DisplayName("Should refuse to dispatch the same window twice")
    void testMarkDispatched_Duplicate() {
        state.markDispatched(window(1, 10), new CompletableFuture<>(), 0L);
        assertThrows(IllegalStateException.class,
            () -> state.markDispatched(window(1, 10), new CompletableFuture<>(), 5L));
    }

    @Test
    @DisplayName("Failure of the current attempt is reported, of a superseded attempt discarded")
    void testReceive_Failures() {
        state.markDispatched(window(1, 10), new CompletableFuture<>(), 0L);
        assertEquals(2, state.redispatch(1, new CompletableFuture<>(), 100L));

        assertEquals(ReductionState.Receipt.DISCARDED,
            state.receive(CompletionMessage.failure(1, 1, new IllegalStateException("old"))));
        assertEquals(ReductionState.Receipt.FAILED,
            state.receive(CompletionMessage.failure(1, 2, new IllegalStateException("current"))));
        assertTrue(state.hasInFlight());
    }

    @Test
    @DisplayName("Late success from a superseded attempt is still folded once")
    void testReceive_SupersededSuccess() {
        state.markDispatched(window(1, 3), new CompletableFuture<>(), 0L);
        state.redispatch(1, new CompletableFuture<>(), 10L);

        assertEquals(ReductionState.Receipt.FOLDED, state.receive(CompletionMessage.success(1, 1, 6L)));
        assertEquals(ReductionState.Receipt.DISCARDED, state.receive(CompletionMessage.success(1, 2, 6L)));
        assertEquals(6L, state.accumulator());
        assertEquals(1, state.redispatches());
    }

    @Test
    @DisplayName("Only attempts older than the timeout are stale")
    void testStaleWindows() {
        state.markDispatched(window(1, 10), new CompletableFuture<>(), 0L);
        state.markDispatched(window(11, 20), new CompletableFuture<>(), 500L);

        List<InFlightWindow> stale = state.staleWindows(1_000L, 1_000L);
        assertEquals(1, stale.size());
        assertEquals(1, stale.get(0).getWindow().getStart());

        state.redispatch(1, new CompletableFuture<>(), 1_000L);
        assertTrue(state.staleWindows(1_200L, 1_000L).isEmpty());
    }

    @Test
    @DisplayName("Should refuse to re-dispatch a window that is not in flight")
    void testRedispatch_Unknown() {
        assertThrows(IllegalStateException.class,
            () -> state.redispatch(7, new CompletableFuture<>(), 0L));
    }
}
