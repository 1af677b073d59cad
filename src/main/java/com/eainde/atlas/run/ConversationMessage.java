package com.eainde.atlas.run;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a run's conversation history.
 *
 * @param role           who produced the entry
 * @param content        text content, never null
 * @param toolCalls      tool requests attached to an assistant entry, empty otherwise
 * @param toolInvocation outcome attached to a tool-result entry, null otherwise
 */
public record ConversationMessage(MessageRole role, String content, List<ToolCallRequest> toolCalls,
                                  ToolInvocation toolInvocation) {

    public ConversationMessage {
        Objects.requireNonNull(role, "role");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        if (!toolCalls.isEmpty() && role != MessageRole.ASSISTANT) {
            throw new IllegalArgumentException("Only assistant messages can carry tool calls");
        }
        if (role == MessageRole.TOOL_RESULT && toolInvocation == null) {
            throw new IllegalArgumentException("Tool-result messages need the invocation they report");
        }
    }

    public static ConversationMessage of(MessageRole role, String content) {
        return new ConversationMessage(role, content, List.of(), null);
    }

    public static ConversationMessage user(String content) {
        return of(MessageRole.USER, content);
    }

    public static ConversationMessage system(String content) {
        return of(MessageRole.SYSTEM, content);
    }

    public static ConversationMessage assistant(String content) {
        return of(MessageRole.ASSISTANT, content);
    }

    public static ConversationMessage assistantToolCalls(String content, List<ToolCallRequest> toolCalls) {
        return new ConversationMessage(MessageRole.ASSISTANT, content, toolCalls, null);
    }

    public static ConversationMessage toolResult(ToolInvocation invocation, String content) {
        return new ConversationMessage(MessageRole.TOOL_RESULT, content, List.of(), invocation);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
