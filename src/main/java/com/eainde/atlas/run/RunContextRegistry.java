package com.eainde.atlas.run;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live runs by run id. Graph nodes use it to resolve the context of the run whose graph
 * state they receive.
 */
@Slf4j
public class RunContextRegistry {

    private final Map<String, RunContext> active = new ConcurrentHashMap<>();

    public void register(RunContext context) {
        RunContext previous = active.putIfAbsent(context.runId(), context);
        if (previous != null) {
            throw new IllegalStateException("Run " + context.runId() + " is already active");
        }
        log.debug("Registered run {}", context.runId());
    }

    public RunContext require(String runId) {
        RunContext context = runId == null ? null : active.get(runId);
        if (context == null) {
            throw new IllegalStateException("No active run with id " + runId);
        }
        return context;
    }

    public void unregister(String runId) {
        active.remove(runId);
    }

    public Set<String> activeRunIds() {
        return Set.copyOf(active.keySet());
    }
}
