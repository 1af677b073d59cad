package com.eainde.atlas.workflow;

import com.eainde.atlas.error.RunCancelledException;
import com.eainde.atlas.run.RunContext;
import com.eainde.atlas.run.RunEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Consumer side of a streaming run: a single-pass, blocking iterator over the run's events.
 * <p>
 * The producer blocks while the buffer is full. Closing the stream before the terminal event
 * cancels the run; the producer stops at the next node boundary and records the run as
 * failed. The last event is always {@code FINAL_RESULT} or {@code ERROR} unless the consumer
 * closed early.
 */
@Slf4j
public class RunEventStream implements Iterator<RunEvent>, AutoCloseable {

    private static final long POLL_MILLIS = 100;

    private final String runId;
    private final BlockingQueue<RunEvent> buffer;
    private final CountDownLatch producerDone = new CountDownLatch(1);
    private volatile RunContext context;
    private volatile boolean closed;
    private RunEvent next;
    private boolean terminalDelivered;

    RunEventStream(String runId, int capacity) {
        this.runId = runId;
        this.buffer = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    public String runId() {
        return runId;
    }

    void attach(RunContext runContext) {
        this.context = runContext;
    }

    /**
     * Producer hand-off. Blocks until the consumer has room.
     *
     * @throws RunCancelledException once the consumer has closed the stream
     */
    void publish(RunEvent event) {
        try {
            while (!closed) {
                if (buffer.offer(event, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        throw new RunCancelledException(runId);
    }

    void producerFinished() {
        producerDone.countDown();
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (terminalDelivered || closed) {
            return false;
        }
        try {
            while (next == null) {
                next = buffer.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (next == null && producerDone.getCount() == 0 && buffer.isEmpty()) {
                    log.warn("Producer of run {} ended without a terminal event", runId);
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            return false;
        }
    }

    @Override
    public RunEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Event stream of run " + runId + " is exhausted");
        }
        RunEvent event = next;
        next = null;
        if (event.type().isTerminal()) {
            terminalDelivered = true;
        }
        return event;
    }

    public Stream<RunEvent> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    /**
     * Stops consuming. Cancels the run unless its terminal event was already delivered.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!terminalDelivered && context != null) {
            context.cancel();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Waits for the producer to finish, including its final persistence write.
     *
     * @return false if the producer is still running after {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return producerDone.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
