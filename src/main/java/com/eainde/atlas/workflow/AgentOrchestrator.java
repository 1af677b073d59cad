package com.eainde.atlas.workflow;

import com.eainde.atlas.config.AgentProperties;
import com.eainde.atlas.error.AgentException;
import com.eainde.atlas.error.FailureKind;
import com.eainde.atlas.error.PersistenceException;
import com.eainde.atlas.error.RunFailedException;
import com.eainde.atlas.execution.RunRecord;
import com.eainde.atlas.execution.RunRecordStore;
import com.eainde.atlas.execution.RunStatus;
import com.eainde.atlas.format.Itinerary;
import com.eainde.atlas.format.ItineraryFormatter;
import com.eainde.atlas.run.ConversationMessage;
import com.eainde.atlas.run.RunContext;
import com.eainde.atlas.run.RunContextRegistry;
import com.eainde.atlas.run.RunEvent;
import com.eainde.atlas.run.RunEventSink;
import com.eainde.atlas.run.RunSnapshot;
import com.eainde.atlas.run.RunState;
import com.eainde.atlas.state.TravelAgentState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for executing the travel agent workflow.
 * <p>
 * Both execution modes drive the same compiled graph:
 * <ul>
 * <li>{@link #run(PlanRequest)} blocks until the graph ends and returns the result.</li>
 * <li>{@link #stream(PlanRequest)} runs the graph on the run executor and hands every
 * event to the returned {@link RunEventStream}.</li>
 * </ul>
 * Every accepted run gets a run record that moves PENDING, RUNNING, then COMPLETED or
 * FAILED. The final write is attempted whatever way the run ends.
 */
@Slf4j
@Service
public class AgentOrchestrator {

    static final String MDC_RUN_ID = "runId";

    private final CompiledGraph<TravelAgentState> workflow;
    private final RunContextRegistry contexts;
    private final RunRecordStore runRecordStore;
    private final ItineraryFormatter itineraryFormatter;
    private final AgentProperties properties;
    private final Executor runExecutor;

    public AgentOrchestrator(@Qualifier("travelAgentWorkflow") CompiledGraph<TravelAgentState> workflow,
                             RunContextRegistry contexts,
                             RunRecordStore runRecordStore,
                             ItineraryFormatter itineraryFormatter,
                             AgentProperties properties,
                             @Qualifier("runExecutor") Executor runExecutor) {
        this.workflow = workflow;
        this.contexts = contexts;
        this.runRecordStore = runRecordStore;
        this.itineraryFormatter = itineraryFormatter;
        this.properties = properties;
        this.runExecutor = runExecutor;
    }

    /**
     * Runs the workflow to completion.
     *
     * @throws RunFailedException   when the run fails; carries the failure kind and partial timeline
     * @throws PersistenceException when the run completed but its final write failed; carries the result
     */
    public PlanResult run(PlanRequest request) {
        RunContext context = newContext(request, RunEventSink.NOOP, UUID.randomUUID().toString());
        return execute(context, request);
    }

    /**
     * Starts the workflow and returns its event stream. Closing the stream cancels the run.
     */
    public RunEventStream stream(PlanRequest request) {
        String runId = UUID.randomUUID().toString();
        RunEventStream events = new RunEventStream(runId, properties.getStreamBuffer());
        RunContext context = newContext(request, events::publish, runId);
        events.attach(context);
        try {
            runExecutor.execute(() -> produce(context, request, events));
        } catch (RejectedExecutionException e) {
            throw new RunFailedException(runId, FailureKind.INTERNAL, "No capacity to start run",
                    context.state().snapshot(), e);
        }
        return events;
    }

    private void produce(RunContext context, PlanRequest request, RunEventStream events) {
        context.bindWorker(Thread.currentThread());
        RunEvent terminal;
        try {
            PlanResult result = execute(context, request);
            terminal = RunEvent.finalResult(context.runId(), result);
        } catch (PersistenceException e) {
            // The run itself completed; only its final write failed.
            terminal = e.getResult()
                    .map(result -> RunEvent.finalResult(context.runId(), result))
                    .orElseGet(() -> RunEvent.error(context.runId(), FailureKind.PERSISTENCE, e.getMessage()));
        } catch (RunFailedException e) {
            terminal = RunEvent.error(context.runId(), e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Streaming run {} failed unexpectedly", context.runId(), e);
            terminal = RunEvent.error(context.runId(), FailureKind.INTERNAL, e.getMessage());
        } finally {
            context.unbindWorker();
            Thread.interrupted();
        }
        try {
            context.emitQuietly(terminal);
        } finally {
            events.producerFinished();
        }
    }

    private PlanResult execute(RunContext context, PlanRequest request) {
        RunState state = context.state();
        String runId = state.runId();
        MDC.put(MDC_RUN_ID, runId);
        try {
            try {
                context.recordId(runRecordStore.create(
                        RunRecord.pending(runId, request.userId(), request.sessionId(), request.query())));
            } catch (RuntimeException e) {
                log.error("Could not create run record for run {}", runId, e);
                state.seal();
                throw new RunFailedException(runId, FailureKind.PERSISTENCE,
                        "Could not create run record: " + e.getMessage(), state.snapshot(), e);
            }

            contexts.register(context);
            context.onCheckpoint(this::checkpoint);
            state.appendMessage(ConversationMessage.user(request.userMessage()));
            checkpoint(context);
            log.info("Run {} started for user {}", runId, request.userId());

            Exception failure = null;
            try {
                workflow.invoke(TravelAgentState.initial(runId), RunnableConfig.builder().threadId(runId).build());
            } catch (Exception e) {
                failure = e;
            }

            // Nothing below may be interrupted by a late cancellation.
            context.unbindWorker();
            Thread.interrupted();
            state.seal();
            RunSnapshot snapshot = state.snapshot();

            if (failure == null && snapshot.output() == null) {
                failure = new IllegalStateException("Workflow ended without a final answer");
            }
            if (failure != null) {
                throw fail(context, snapshot, failure);
            }

            PlanResult result = toResult(snapshot);
            try {
                runRecordStore.complete(context.recordId(), RunStatus.COMPLETED, snapshot, null);
            } catch (RuntimeException e) {
                log.error("Run {} completed but its final write failed", runId, e);
                throw asPersistenceException(e).withResult(result);
            }
            log.info("Run {} completed after {} tool cycle(s)", runId, snapshot.iterations());
            return result;
        } finally {
            contexts.unregister(runId);
            MDC.remove(MDC_RUN_ID);
        }
    }

    private RunFailedException fail(RunContext context, RunSnapshot snapshot, Exception failure) {
        FailureKind kind = classify(context, failure);
        Throwable cause = rootAgentException(failure);
        String message = cause != null ? cause.getMessage() : String.valueOf(failure.getMessage());
        if (kind == FailureKind.INTERNAL) {
            log.error("Run {} failed", context.runId(), failure);
        } else {
            log.warn("Run {} failed with {}: {}", context.runId(), kind, message);
        }
        try {
            runRecordStore.complete(context.recordId(), RunStatus.FAILED, snapshot, kind + ": " + message);
        } catch (RuntimeException e) {
            log.error("Could not record failure of run {}", context.runId(), e);
        }
        return new RunFailedException(context.runId(), kind, message, snapshot, cause != null ? cause : failure);
    }

    static FailureKind classify(RunContext context, Throwable failure) {
        if (context.isCancelled()) {
            return FailureKind.CANCELLED;
        }
        AgentException agentException = rootAgentException(failure);
        if (agentException != null) {
            return agentException.getKind();
        }
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return FailureKind.CANCELLED;
            }
        }
        return FailureKind.INTERNAL;
    }

    private static AgentException rootAgentException(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof AgentException agentException) {
                return agentException;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private void checkpoint(RunContext context) {
        try {
            runRecordStore.update(context.recordId(), RunStatus.RUNNING, context.state().snapshot());
        } catch (RuntimeException e) {
            log.warn("Checkpoint of run {} failed: {}", context.runId(), e.getMessage());
        }
    }

    private PlanResult toResult(RunSnapshot snapshot) {
        Itinerary itinerary;
        try {
            itinerary = itineraryFormatter.format(snapshot.output());
        } catch (RuntimeException e) {
            log.warn("Could not format itinerary of run {}: {}", snapshot.runId(), e.getMessage());
            itinerary = Itinerary.empty();
        }
        return new PlanResult(snapshot.runId(), RunStatus.COMPLETED, snapshot.output(), itinerary,
                snapshot.citations(), snapshot.toolInvocations(), snapshot.nodeEvents(), snapshot.messages(),
                snapshot.iterations());
    }

    private RunContext newContext(PlanRequest request, RunEventSink sink, String runId) {
        RunState state = new RunState(runId, request.userId(), request.sessionId(), request.query());
        Instant deadline = Instant.now().plus(request.timeout() != null ? request.timeout() : properties.getRunTimeout());
        return new RunContext(state, sink, deadline);
    }

    private static PersistenceException asPersistenceException(RuntimeException e) {
        return e instanceof PersistenceException persistence
                ? persistence
                : new PersistenceException("Final write failed: " + e.getMessage(), e);
    }
}
