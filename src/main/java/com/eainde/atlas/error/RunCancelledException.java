package com.eainde.atlas.error;

public class RunCancelledException extends AgentException {

    public RunCancelledException(String runId) {
        super(FailureKind.CANCELLED, "Run " + runId + " was cancelled");
    }
}
