package com.eainde.atlas.error;

import com.eainde.atlas.run.RunSnapshot;

/**
 * Thrown by batch execution when a run ends as failed. Carries the failure kind and the
 * partial state (timeline, tool invocations) captured at the point of failure.
 */
public class RunFailedException extends AgentException {

    private final String runId;
    private final transient RunSnapshot snapshot;

    public RunFailedException(String runId, FailureKind kind, String message, RunSnapshot snapshot, Throwable cause) {
        super(kind, message, cause);
        this.runId = runId;
        this.snapshot = snapshot;
    }

    public String getRunId() {
        return runId;
    }

    public RunSnapshot getSnapshot() {
        return snapshot;
    }
}
