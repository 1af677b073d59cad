package com.eainde.atlas.run;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a {@link RunState}, handed to persistence and returned to callers.
 */
public record RunSnapshot(
        String runId,
        String userId,
        String sessionId,
        String query,
        Instant createdAt,
        List<ConversationMessage> messages,
        List<ToolInvocation> toolInvocations,
        List<Citation> citations,
        List<NodeEvent> nodeEvents,
        int iterations,
        String output
) {

    public RunSnapshot {
        messages = List.copyOf(messages);
        toolInvocations = List.copyOf(toolInvocations);
        citations = List.copyOf(citations);
        nodeEvents = List.copyOf(nodeEvents);
    }

    public long assistantMessageCount() {
        return messages.stream().filter(m -> m.role() == MessageRole.ASSISTANT).count();
    }
}
