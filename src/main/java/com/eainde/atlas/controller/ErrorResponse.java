package com.eainde.atlas.controller;

import com.eainde.atlas.run.NodeEvent;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Structured error body: failure kind, message and, for failed runs, the partial timeline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String kind, String message, String runId, List<NodeEvent> timeline) {

    public static ErrorResponse of(String kind, String message) {
        return new ErrorResponse(kind, message, null, null);
    }
}
