package com.eainde.atlas.run;

import com.eainde.atlas.error.AlreadyFinalizedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable record threading through one run: conversation history, tool invocations,
 * citations, node timeline and the terminal output.
 * <p>
 * A run state is owned by exactly one run task and mutated only by the graph nodes of that
 * run, so it carries no locking. History and timeline are append-only; once the graph
 * terminates the state is {@link #seal() sealed} and every mutator fails.
 */
public class RunState {

    private final String runId;
    private final String userId;
    private final String sessionId;
    private final String query;
    private final Instant createdAt;

    private final List<ConversationMessage> messages = new ArrayList<>();
    private final List<ToolInvocation> toolInvocations = new ArrayList<>();
    private final List<Citation> citations = new ArrayList<>();
    private final List<NodeEvent> nodeEvents = new ArrayList<>();

    private int iteration;
    private String output;
    private boolean sealed;

    public RunState(String runId, String userId, String sessionId, String query) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.userId = userId;
        this.sessionId = sessionId;
        this.query = query;
        this.createdAt = Instant.now();
    }

    public void appendMessage(MessageRole role, String content) {
        appendMessage(ConversationMessage.of(role, content));
    }

    public void appendMessage(ConversationMessage message) {
        ensureOpen();
        messages.add(Objects.requireNonNull(message, "message"));
    }

    /**
     * Appends a tool outcome. Call ids are provider-assigned and may repeat across turns, so
     * invocations are kept in recording order rather than keyed by id.
     */
    public void recordToolResult(ToolInvocation invocation) {
        ensureOpen();
        toolInvocations.add(Objects.requireNonNull(invocation, "invocation"));
    }

    public void recordCitation(String source, String snippet, String toolInvocationRef) {
        ensureOpen();
        citations.add(new Citation(source, snippet, toolInvocationRef));
    }

    public void recordNodeEvent(String nodeName, NodeStatus status, Instant startedAt, Instant endedAt, String error) {
        ensureOpen();
        if (endedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("Node " + nodeName + " ended before it started");
        }
        if (!nodeEvents.isEmpty() && startedAt.isBefore(nodeEvents.get(nodeEvents.size() - 1).startedAt())) {
            throw new IllegalStateException("Node events must be recorded in start order");
        }
        nodeEvents.add(new NodeEvent(nodeName, status, startedAt, endedAt, iteration, error));
    }

    /**
     * Sets the terminal output. A run has at most one; the first value always wins.
     *
     * @throws AlreadyFinalizedException on a second call
     */
    public void finalizeOutput(String finalOutput) {
        if (output != null) {
            throw new AlreadyFinalizedException(runId);
        }
        ensureOpen();
        output = Objects.requireNonNull(finalOutput, "finalOutput");
    }

    public int incrementIteration() {
        ensureOpen();
        return ++iteration;
    }

    /**
     * @return tool calls attached to the latest entry when it is an assistant request,
     *         empty otherwise
     */
    public List<ToolCallRequest> pendingToolCalls() {
        if (messages.isEmpty()) {
            return List.of();
        }
        ConversationMessage last = messages.get(messages.size() - 1);
        return last.role() == MessageRole.ASSISTANT ? last.toolCalls() : List.of();
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public boolean isFinalized() {
        return output != null;
    }

    public Optional<String> output() {
        return Optional.ofNullable(output);
    }

    public int iteration() {
        return iteration;
    }

    public String runId() {
        return runId;
    }

    public String userId() {
        return userId;
    }

    public String sessionId() {
        return sessionId;
    }

    public String query() {
        return query;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<ConversationMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public List<ToolInvocation> toolInvocations() {
        return List.copyOf(toolInvocations);
    }

    public List<Citation> citations() {
        return Collections.unmodifiableList(citations);
    }

    public List<NodeEvent> nodeEvents() {
        return Collections.unmodifiableList(nodeEvents);
    }

    public RunSnapshot snapshot() {
        return new RunSnapshot(runId, userId, sessionId, query, createdAt,
                messages, toolInvocations(), citations, nodeEvents, iteration, output);
    }

    private void ensureOpen() {
        if (sealed) {
            throw new IllegalStateException("Run " + runId + " is sealed");
        }
    }
}
