package com.eainde.atlas.error;

import java.util.List;

/**
 * Raised when tool-call arguments do not satisfy the capability's schema.
 * Carries every violation found, not just the first one.
 */
public class ToolArgumentsException extends AgentException {

    private final String toolName;
    private final List<String> violations;

    public ToolArgumentsException(String toolName, List<String> violations) {
        super(FailureKind.VALIDATION,
                "Invalid arguments for '" + toolName + "': " + String.join("; ", violations));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }

    public String getToolName() {
        return toolName;
    }

    public List<String> getViolations() {
        return violations;
    }
}
