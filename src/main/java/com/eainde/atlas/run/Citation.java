package com.eainde.atlas.run;

/**
 * Source attribution collected during a run.
 *
 * @param toolInvocationId call id of the invocation that produced the source, may be null
 */
public record Citation(String source, String snippet, String toolInvocationId) {
}
