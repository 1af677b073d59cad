package com.eainde.atlas.error;

public class AlreadyFinalizedException extends AgentException {

    public AlreadyFinalizedException(String runId) {
        super(FailureKind.ALREADY_FINALIZED, "Run " + runId + " already has a terminal output");
    }
}
