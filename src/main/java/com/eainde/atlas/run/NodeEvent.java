package com.eainde.atlas.run;

import java.time.Duration;
import java.time.Instant;

/**
 * Timeline entry for one execution of a graph node.
 *
 * @param iteration completed reasoning/tool cycles when the node started
 * @param error     failure message for {@link NodeStatus#ERROR} events
 */
public record NodeEvent(String nodeName, NodeStatus status, Instant startedAt, Instant endedAt,
                        int iteration, String error) {

    public long durationMillis() {
        return Duration.between(startedAt, endedAt).toMillis();
    }
}
