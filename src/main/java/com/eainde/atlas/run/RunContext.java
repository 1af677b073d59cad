package com.eainde.atlas.run;

import com.eainde.atlas.error.ReasoningUnavailableException;
import com.eainde.atlas.error.RunCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Per-run execution context shared by the graph nodes of a single run: the {@link RunState},
 * the event sink, the optional deadline and the cancellation flag.
 * <p>
 * The graph state only carries the run id; nodes resolve this context through
 * {@link RunContextRegistry}.
 */
@Slf4j
public class RunContext {

    private final RunState state;
    private final RunEventSink sink;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<Thread> worker = new AtomicReference<>();
    private final AtomicLong sequence = new AtomicLong();
    private volatile Consumer<RunContext> checkpointListener = ctx -> {
    };
    private volatile String recordId;

    public RunContext(RunState state, RunEventSink sink, Instant deadline) {
        this.state = Objects.requireNonNull(state, "state");
        this.sink = sink == null ? RunEventSink.NOOP : sink;
        this.deadline = deadline;
    }

    public String runId() {
        return state.runId();
    }

    public RunState state() {
        return state;
    }

    public String recordId() {
        return recordId;
    }

    public void recordId(String id) {
        this.recordId = id;
    }

    public void onCheckpoint(Consumer<RunContext> listener) {
        this.checkpointListener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Invoked after every successful node execution.
     */
    public void checkpoint() {
        checkpointListener.accept(this);
    }

    public void bindWorker(Thread thread) {
        worker.set(thread);
        if (cancelled.get()) {
            thread.interrupt();
        }
    }

    public void unbindWorker() {
        worker.set(null);
    }

    /**
     * Requests cancellation and interrupts the thread currently driving the graph, if any.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested for run {}", runId());
            Thread thread = worker.get();
            if (thread != null) {
                thread.interrupt();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Instant deadline() {
        return deadline;
    }

    /**
     * Node-boundary check.
     *
     * @throws RunCancelledException         when the consumer cancelled the run
     * @throws ReasoningUnavailableException when the run deadline has passed
     */
    public void checkActive() {
        if (cancelled.get()) {
            throw new RunCancelledException(runId());
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            throw new ReasoningUnavailableException("Run deadline exceeded");
        }
    }

    /**
     * @return {@code limit}, shortened to the time left before the run deadline
     * @throws ReasoningUnavailableException when no time is left
     */
    public Duration boundedTimeout(Duration limit) {
        if (deadline == null) {
            return limit;
        }
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new ReasoningUnavailableException("Run deadline exceeded");
        }
        return remaining.compareTo(limit) < 0 ? remaining : limit;
    }

    /**
     * Emits the events back to back; no other event of this run is interleaved between them.
     */
    public synchronized void emit(RunEvent... events) {
        for (RunEvent event : events) {
            sink.emit(event.withSequence(sequence.incrementAndGet()));
        }
    }

    /**
     * Emits without propagating sink failures, for paths that are already failing.
     */
    public void emitQuietly(RunEvent... events) {
        try {
            emit(events);
        } catch (RuntimeException e) {
            log.debug("Dropped events for run {}: {}", runId(), e.getMessage());
        }
    }
}
