package com.eainde.atlas.tools;

/**
 * A source a tool result can be credited to. Recorded as a citation on the run.
 */
public record SourceAttribution(String source, String snippet) {
}
