package com.eainde.atlas.edges;

import com.eainde.atlas.state.TravelAgentState;
import com.eainde.atlas.workflow.GraphNodeState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Follows the route the reasoning node chose. A state without a route ends the graph.
 */
@Component
public class ReasoningRoutingEdge implements AsyncEdgeAction<TravelAgentState> {

    @Override
    public CompletableFuture<String> apply(TravelAgentState state) {
        String next = state.getNext();
        return CompletableFuture.completedFuture(next == null ? GraphNodeState.END.name() : next);
    }
}
