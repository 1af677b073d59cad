package com.eainde.atlas.execution;

import com.eainde.atlas.run.NodeEvent;

import java.time.Instant;
import java.util.List;

/**
 * Persistence-facing projection of a run.
 *
 * @param finalResponse terminal output, null until the run completes
 * @param timeline      node events recorded so far
 * @param error         failure description of a FAILED run
 */
public record RunRecord(
        String id,
        String userId,
        String sessionId,
        String query,
        RunStatus status,
        Instant createdAt,
        Instant updatedAt,
        String finalResponse,
        List<NodeEvent> timeline,
        int iterations,
        String error
) {

    public RunRecord {
        timeline = timeline == null ? List.of() : List.copyOf(timeline);
    }

    /**
     * Creates a new PENDING record when a run is accepted.
     */
    public static RunRecord pending(String id, String userId, String sessionId, String query) {
        Instant now = Instant.now();
        return new RunRecord(id, userId, sessionId, query, RunStatus.PENDING, now, now,
                null, List.of(), 0, null);
    }
}
