package com.eainde.atlas.reasoning;

import com.eainde.atlas.run.ToolCallRequest;

import java.util.List;

/**
 * Outcome of one reasoning step: either a final answer (no tool requests) or an ordered
 * list of tool requests, optionally with accompanying text.
 */
public record ReasoningOutput(String text, List<ToolCallRequest> toolRequests) {

    public ReasoningOutput {
        text = text == null ? "" : text;
        toolRequests = toolRequests == null ? List.of() : List.copyOf(toolRequests);
    }

    public static ReasoningOutput finalAnswer(String text) {
        return new ReasoningOutput(text, List.of());
    }

    public static ReasoningOutput toolRequests(List<ToolCallRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("At least one tool request is required");
        }
        return new ReasoningOutput("", requests);
    }

    public boolean isFinal() {
        return toolRequests.isEmpty();
    }
}
