package com.eainde.atlas.error;

public class ReasoningUnavailableException extends AgentException {

    public ReasoningUnavailableException(String message) {
        super(FailureKind.REASONING_UNAVAILABLE, message);
    }

    public ReasoningUnavailableException(String message, Throwable cause) {
        super(FailureKind.REASONING_UNAVAILABLE, message, cause);
    }
}
