package com.eainde.atlas.run;

import com.eainde.atlas.error.FailureKind;
import com.eainde.atlas.workflow.PlanResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A discrete event yielded by streaming execution. Only the fields relevant to the
 * {@link RunEventType} are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunEvent(
        RunEventType type,
        String runId,
        long sequence,
        Instant timestamp,
        String node,
        NodeStatus nodeStatus,
        ToolCallRequest toolCall,
        ToolInvocation toolInvocation,
        String delta,
        PlanResult result,
        FailureKind failureKind,
        String error
) {

    public static RunEvent nodeStarted(String runId, String node) {
        return new RunEvent(RunEventType.NODE_STARTED, runId, 0, Instant.now(), node, null,
                null, null, null, null, null, null);
    }

    public static RunEvent nodeFinished(String runId, String node, NodeStatus status) {
        return new RunEvent(RunEventType.NODE_FINISHED, runId, 0, Instant.now(), node, status,
                null, null, null, null, null, null);
    }

    public static RunEvent toolCallStarted(String runId, ToolCallRequest request, Instant startedAt) {
        return new RunEvent(RunEventType.TOOL_CALL_STARTED, runId, 0, startedAt, null, null,
                request, null, null, null, null, null);
    }

    public static RunEvent toolCallFinished(String runId, ToolInvocation invocation) {
        return new RunEvent(RunEventType.TOOL_CALL_FINISHED, runId, 0, invocation.completedAt(), null, null,
                null, invocation, null, null, invocation.failureKind(), invocation.error());
    }

    public static RunEvent messageDelta(String runId, String delta) {
        return new RunEvent(RunEventType.MESSAGE_DELTA, runId, 0, Instant.now(), null, null,
                null, null, delta, null, null, null);
    }

    public static RunEvent finalResult(String runId, PlanResult result) {
        return new RunEvent(RunEventType.FINAL_RESULT, runId, 0, Instant.now(), null, null,
                null, null, null, result, null, null);
    }

    public static RunEvent error(String runId, FailureKind kind, String message) {
        return new RunEvent(RunEventType.ERROR, runId, 0, Instant.now(), null, null,
                null, null, null, null, kind, message);
    }

    public RunEvent withSequence(long value) {
        return new RunEvent(type, runId, value, timestamp, node, nodeStatus, toolCall, toolInvocation,
                delta, result, failureKind, error);
    }
}
