package com.eainde.atlas.nodes;

import com.eainde.atlas.config.AgentProperties;
import com.eainde.atlas.error.AgentException;
import com.eainde.atlas.error.FailureKind;
import com.eainde.atlas.error.RunCancelledException;
import com.eainde.atlas.error.UnknownCapabilityException;
import com.eainde.atlas.run.ConversationMessage;
import com.eainde.atlas.run.RunContext;
import com.eainde.atlas.run.RunContextRegistry;
import com.eainde.atlas.run.RunEvent;
import com.eainde.atlas.run.RunState;
import com.eainde.atlas.run.ToolCallRequest;
import com.eainde.atlas.run.ToolInvocation;
import com.eainde.atlas.state.TravelAgentState;
import com.eainde.atlas.tools.SourceAttribution;
import com.eainde.atlas.tools.ToolCallable;
import com.eainde.atlas.tools.ToolRegistry;
import com.eainde.atlas.tools.ToolResult;
import com.eainde.atlas.workflow.GraphNodeState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes the tool calls requested by the latest reasoning step.
 * <p>
 * All calls of a turn run concurrently on the tool executor, bounded together by the tool
 * timeout measured from dispatch. Calls still running at the timeout are cancelled with an
 * interrupt, which frees their pool thread. Every failure (unknown tool, invalid arguments,
 * a repeated call id, a failing or slow tool) is turned into a failed {@link ToolInvocation};
 * nothing tool-related escapes this node. Outcomes are recorded in request order once all
 * calls have resolved.
 * <p>
 * A call's started event is emitted only once the call has resolved, immediately followed by
 * its finished event, so listeners never observe a call that is still running.
 */
@Slf4j
@Component
public class ToolDispatchNode extends AbstractRunNode {

    public static final String NAME = "tool_dispatch";

    private final ToolRegistry toolRegistry;
    private final ExecutorService toolExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    public ToolDispatchNode(RunContextRegistry contexts,
                            ToolRegistry toolRegistry,
                            @Qualifier("toolExecutor") ExecutorService toolExecutor,
                            AgentProperties properties,
                            ObjectMapper objectMapper) {
        super(contexts);
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Map<String, Object> execute(RunContext context) {
        RunState run = context.state();
        List<ToolCallRequest> requests = run.pendingToolCalls();
        Duration timeout = context.boundedTimeout(properties.getToolTimeout());
        Map<String, ToolCallable> callables = toolRegistry.createCallables();

        BlockingQueue<Outcome> completed = new LinkedBlockingQueue<>();
        Map<Integer, Future<?>> running = new HashMap<>();
        Set<String> seenIds = new HashSet<>();
        Instant[] dispatchedAt = new Instant[requests.size()];
        long expiresAt = System.nanoTime() + timeout.toNanos();
        for (int i = 0; i < requests.size(); i++) {
            ToolCallRequest request = requests.get(i);
            Instant startedAt = Instant.now();
            dispatchedAt[i] = startedAt;
            if (!seenIds.add(request.id())) {
                completed.add(failed(i, request, startedAt, FailureKind.VALIDATION,
                        "Duplicate tool call id '" + request.id() + "' in one turn"));
                continue;
            }
            ToolCallable callable = callables.get(request.name());
            if (callable == null) {
                UnknownCapabilityException unknown = new UnknownCapabilityException(request.name());
                completed.add(failed(i, request, startedAt, classify(unknown), unknown.getMessage()));
                continue;
            }
            int index = i;
            running.put(i, toolExecutor.submit(() -> invoke(index, request, callable, startedAt, timeout, completed)));
        }

        // Join barrier. Each start/finish pair is emitted as one unit, in completion order.
        Outcome[] outcomes = new Outcome[requests.size()];
        try {
            int resolved = 0;
            while (resolved < outcomes.length) {
                long remaining = expiresAt - System.nanoTime();
                Outcome outcome = remaining > 0 ? completed.poll(remaining, TimeUnit.NANOSECONDS) : completed.poll();
                if (outcome == null) {
                    break;
                }
                accept(context, outcomes, running, outcome);
                resolved++;
            }
            for (int i = 0; i < outcomes.length; i++) {
                if (outcomes[i] == null) {
                    ToolCallRequest request = requests.get(i);
                    Future<?> call = running.get(i);
                    if (call != null) {
                        call.cancel(true);
                    }
                    accept(context, outcomes, running, failed(i, request, dispatchedAt[i],
                            FailureKind.TOOL_TIMEOUT, timedOut(request, timeout)));
                }
            }
        } catch (InterruptedException e) {
            running.values().forEach(call -> call.cancel(true));
            Thread.currentThread().interrupt();
            throw new RunCancelledException(context.runId());
        } catch (RuntimeException e) {
            running.values().forEach(call -> call.cancel(true));
            throw e;
        }

        for (Outcome outcome : outcomes) {
            ToolInvocation invocation = outcome.invocation();
            run.recordToolResult(invocation);
            run.appendMessage(ConversationMessage.toolResult(invocation, render(invocation)));
            for (SourceAttribution source : outcome.sources()) {
                run.recordCitation(source.source(), source.snippet(), invocation.callId());
            }
        }
        int iteration = run.incrementIteration();
        log.info("Run {} finished tool cycle {}: {}/{} call(s) succeeded", context.runId(), iteration,
                Arrays.stream(outcomes).filter(o -> o.invocation().success()).count(), outcomes.length);
        return TravelAgentState.route(GraphNodeState.REASONING.name());
    }

    private static void accept(RunContext context, Outcome[] outcomes, Map<Integer, Future<?>> running, Outcome outcome) {
        outcomes[outcome.index()] = outcome;
        running.remove(outcome.index());
        context.emit(
                RunEvent.toolCallStarted(context.runId(), outcome.request(), outcome.invocation().startedAt()),
                RunEvent.toolCallFinished(context.runId(), outcome.invocation()));
    }

    // Runs on a tool worker. A cancelled call publishes nothing; the node has already
    // recorded it as timed out or the run is being cancelled.
    private static void invoke(int index, ToolCallRequest request, ToolCallable callable, Instant startedAt,
                               Duration timeout, BlockingQueue<Outcome> completed) {
        ToolResult result = null;
        Throwable error = null;
        try {
            result = callable.invoke(request.arguments()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (ExecutionException | RuntimeException e) {
            error = e;
        }
        if (Thread.currentThread().isInterrupted()) {
            return;
        }
        completed.add(toOutcome(index, request, startedAt, result, error, timeout));
    }

    private static Outcome failed(int index, ToolCallRequest request, Instant startedAt, FailureKind kind, String message) {
        log.warn("Tool call {} ({}) failed: {}", request.id(), request.name(), message);
        return new Outcome(index, request,
                ToolInvocation.failed(request, kind, message, startedAt, Instant.now()), List.of());
    }

    private static String timedOut(ToolCallRequest request, Duration timeout) {
        return "Tool '" + request.name() + "' timed out after " + timeout.toMillis() + " ms";
    }

    private static Outcome toOutcome(int index, ToolCallRequest request, Instant startedAt,
                                     ToolResult result, Throwable error, Duration timeout) {
        Instant completedAt = Instant.now();
        if (error != null) {
            Throwable cause = unwrap(error);
            FailureKind kind = classify(cause);
            String message = kind == FailureKind.TOOL_TIMEOUT ? timedOut(request, timeout) : describe(request, cause);
            return failed(index, request, startedAt, kind, message);
        }
        if (result == null || !result.success()) {
            String message = result == null ? "Tool '" + request.name() + "' returned no result" : result.error();
            log.warn("Tool call {} ({}) reported failure: {}", request.id(), request.name(), message);
            return new Outcome(index, request,
                    ToolInvocation.failed(request, FailureKind.TOOL_EXECUTION, message, startedAt, completedAt), List.of());
        }
        return new Outcome(index, request,
                ToolInvocation.succeeded(request, result.payload(), startedAt, completedAt), result.sources());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static FailureKind classify(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return FailureKind.TOOL_TIMEOUT;
        }
        if (cause instanceof AgentException agentException && !agentException.getKind().isFatal()) {
            return agentException.getKind();
        }
        return FailureKind.TOOL_EXECUTION;
    }

    private static String describe(ToolCallRequest request, Throwable cause) {
        if (cause instanceof AgentException) {
            return cause.getMessage();
        }
        return "Tool '" + request.name() + "' failed: " + cause;
    }

    private String render(ToolInvocation invocation) {
        if (!invocation.success()) {
            return "Error: " + invocation.error();
        }
        try {
            return objectMapper.writeValueAsString(invocation.result());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize result of tool call {}", invocation.callId(), e);
            return String.valueOf(invocation.result());
        }
    }

    private record Outcome(int index, ToolCallRequest request, ToolInvocation invocation,
                           List<SourceAttribution> sources) {
    }
}
