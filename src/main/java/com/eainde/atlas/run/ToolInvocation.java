package com.eainde.atlas.run;

import com.eainde.atlas.error.FailureKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Record of one actual tool call and its outcome. Exactly one exists per
 * {@link ToolCallRequest} that reached the dispatch node.
 */
public record ToolInvocation(
        String callId,
        String name,
        Map<String, Object> arguments,
        Object result,
        boolean success,
        String error,
        FailureKind failureKind,
        Instant startedAt,
        Instant completedAt
) {

    public static ToolInvocation succeeded(ToolCallRequest request, Object result, Instant startedAt, Instant completedAt) {
        return new ToolInvocation(request.id(), request.name(), request.arguments(), result,
                true, null, null, startedAt, completedAt);
    }

    public static ToolInvocation failed(ToolCallRequest request, FailureKind kind, String error,
                                        Instant startedAt, Instant completedAt) {
        return new ToolInvocation(request.id(), request.name(), request.arguments(), null,
                false, error, kind, startedAt, completedAt);
    }

    public long durationMillis() {
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
