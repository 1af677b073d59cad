package com.eainde.atlas.error;

public class DuplicateCapabilityException extends AgentException {

    public DuplicateCapabilityException(String name) {
        super(FailureKind.DUPLICATE_CAPABILITY, "Capability already registered: " + name);
    }
}
