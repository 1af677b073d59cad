package com.eainde.atlas.error;

/**
 * Classifies every failure the agent core can report.
 * <p>
 * Tool-level kinds are recovered inside the tool-dispatch node and recorded as data;
 * run-level kinds abort the graph and end the run as failed.
 */
public enum FailureKind {
    VALIDATION(false),
    UNKNOWN_CAPABILITY(false),
    TOOL_EXECUTION(false),
    TOOL_TIMEOUT(false),
    REASONING_UNAVAILABLE(true),
    MAX_ITERATIONS_EXCEEDED(true),
    PERSISTENCE(true),
    DUPLICATE_CAPABILITY(true),
    ALREADY_FINALIZED(true),
    CANCELLED(true),
    INTERNAL(true);

    private final boolean fatal;

    FailureKind(boolean fatal) {
        this.fatal = fatal;
    }

    /**
     * @return true when a failure of this kind ends the run
     */
    public boolean isFatal() {
        return fatal;
    }
}
