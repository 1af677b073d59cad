package com.eainde.atlas.state;

import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;

/**
 * Graph state of the travel agent workflow. Holds only the run id and the route chosen by
 * the last reasoning step; everything else lives in the run's
 * {@link com.eainde.atlas.run.RunContext}.
 */
public class TravelAgentState extends AgentState {

    public static final String RUN_ID = "runId";
    public static final String NEXT = "next";

    public TravelAgentState(Map<String, Object> initData) {
        super(initData);
    }

    public String getRunId() {
        return this.<String>value(RUN_ID).orElse(null);
    }

    public String getNext() {
        return this.<String>value(NEXT).orElse(null);
    }

    public static Map<String, Object> initial(String runId) {
        return Map.of(RUN_ID, runId);
    }

    public static Map<String, Object> route(String next) {
        return Map.of(NEXT, next);
    }
}
