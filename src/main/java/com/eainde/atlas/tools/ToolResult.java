package com.eainde.atlas.tools;

import java.util.List;

/**
 * Outcome of one capability execution.
 *
 * @param success whether the capability produced a usable payload
 * @param payload structured result, null on failure
 * @param error   description of the failure, null on success
 * @param sources attributions for the payload, never null
 */
public record ToolResult(boolean success, Object payload, String error, List<SourceAttribution> sources) {

    public ToolResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static ToolResult success(Object payload) {
        return new ToolResult(true, payload, null, List.of());
    }

    public static ToolResult success(Object payload, List<SourceAttribution> sources) {
        return new ToolResult(true, payload, null, sources);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, List.of());
    }
}
