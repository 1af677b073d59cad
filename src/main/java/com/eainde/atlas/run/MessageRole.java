package com.eainde.atlas.run;

public enum MessageRole {
    USER,
    ASSISTANT,
    TOOL_RESULT,
    SYSTEM
}
