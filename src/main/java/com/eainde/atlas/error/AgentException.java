package com.eainde.atlas.error;

/**
 * Root of the agent core's exception hierarchy. Every subtype carries the
 * {@link FailureKind} used for run records, stream error events and HTTP mapping.
 */
public class AgentException extends RuntimeException {

    private final FailureKind kind;

    public AgentException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
