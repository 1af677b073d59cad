package com.eainde.atlas.error;

public class UnknownCapabilityException extends AgentException {

    private final String capabilityName;

    public UnknownCapabilityException(String capabilityName) {
        super(FailureKind.UNKNOWN_CAPABILITY, "Unknown capability: " + capabilityName);
        this.capabilityName = capabilityName;
    }

    public String getCapabilityName() {
        return capabilityName;
    }
}
