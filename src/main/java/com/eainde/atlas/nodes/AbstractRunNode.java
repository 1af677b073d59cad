package com.eainde.atlas.nodes;

import com.eainde.atlas.run.NodeStatus;
import com.eainde.atlas.run.RunContext;
import com.eainde.atlas.run.RunContextRegistry;
import com.eainde.atlas.run.RunEvent;
import com.eainde.atlas.state.TravelAgentState;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base of the travel agent nodes. Resolves the run context, checks cancellation and the
 * deadline at the node boundary, and records exactly one node event per execution, also
 * when the node fails.
 */
@Slf4j
public abstract class AbstractRunNode implements AsyncNodeAction<TravelAgentState> {

    private final RunContextRegistry contexts;

    protected AbstractRunNode(RunContextRegistry contexts) {
        this.contexts = contexts;
    }

    public abstract String name();

    /**
     * @return the graph state update
     */
    protected abstract Map<String, Object> execute(RunContext context);

    @Override
    public CompletableFuture<Map<String, Object>> apply(TravelAgentState state) {
        RunContext context;
        try {
            context = contexts.require(state.getRunId());
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }

        Instant startedAt = Instant.now();
        Map<String, Object> update;
        try {
            context.checkActive();
            context.emit(RunEvent.nodeStarted(context.runId(), name()));
            update = execute(context);
        } catch (RuntimeException e) {
            log.warn("Node '{}' failed for run {}: {}", name(), context.runId(), e.getMessage());
            recordFailure(context, startedAt, e);
            context.emitQuietly(RunEvent.nodeFinished(context.runId(), name(), NodeStatus.ERROR));
            return CompletableFuture.failedFuture(e);
        }

        try {
            context.state().recordNodeEvent(name(), NodeStatus.SUCCESS, startedAt, Instant.now(), null);
            log.debug("Node '{}' finished for run {}", name(), context.runId());
            context.emit(RunEvent.nodeFinished(context.runId(), name(), NodeStatus.SUCCESS));
            context.checkpoint();
        } catch (RuntimeException e) {
            log.warn("Node '{}' could not be completed for run {}: {}", name(), context.runId(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.completedFuture(update);
    }

    private void recordFailure(RunContext context, Instant startedAt, RuntimeException error) {
        try {
            context.state().recordNodeEvent(name(), NodeStatus.ERROR, startedAt, Instant.now(), error.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not record failed node event for run {}", context.runId(), e);
        }
    }
}
