package com.di.bigfactorial.reduce;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Multi-producer, single-consumer queue carrying {@link CompletionMessage}s
 * from workers to the orchestrator. Workers only {@link #send}; the reducer
 * is the only caller of {@link #poll}.
 */
public class CompletionChannel<T> {

    private final BlockingQueue<CompletionMessage<T>> queue = new LinkedBlockingQueue<>();

    public void send(CompletionMessage<T> message) {
        queue.add(message);
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the message, or {@code null} if none arrived in time
     */
    public CompletionMessage<T> poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
