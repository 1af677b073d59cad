package com.eainde.atlas.error;

import com.eainde.atlas.workflow.PlanResult;

import java.util.Optional;

/**
 * Raised when the run-record store cannot be written. When the run itself succeeded the
 * computed result travels with the exception so callers do not lose it.
 */
public class PersistenceException extends AgentException {

    private final transient PlanResult result;

    public PersistenceException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public PersistenceException(String message, Throwable cause, PlanResult result) {
        super(FailureKind.PERSISTENCE, message, cause);
        this.result = result;
    }

    public Optional<PlanResult> getResult() {
        return Optional.ofNullable(result);
    }

    public PersistenceException withResult(PlanResult computed) {
        PersistenceException copy = new PersistenceException(getMessage(), getCause(), computed);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
