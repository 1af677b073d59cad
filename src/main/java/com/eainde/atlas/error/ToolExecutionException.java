package com.eainde.atlas.error;

public class ToolExecutionException extends AgentException {

    public ToolExecutionException(String toolName, String message) {
        super(FailureKind.TOOL_EXECUTION, "Tool '" + toolName + "' failed: " + message);
    }

    public ToolExecutionException(String toolName, Throwable cause) {
        super(FailureKind.TOOL_EXECUTION, "Tool '" + toolName + "' failed: " + cause.getMessage(), cause);
    }
}
