package com.eainde.atlas.run;

import java.util.Locale;

public enum RunEventType {
    NODE_STARTED,
    NODE_FINISHED,
    TOOL_CALL_STARTED,
    TOOL_CALL_FINISHED,
    MESSAGE_DELTA,
    FINAL_RESULT,
    ERROR;

    public boolean isTerminal() {
        return this == FINAL_RESULT || this == ERROR;
    }

    /**
     * @return kebab-case name used for server-sent event frames, e.g. {@code tool-call-started}
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
