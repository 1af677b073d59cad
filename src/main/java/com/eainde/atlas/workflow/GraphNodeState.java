package com.eainde.atlas.workflow;

import com.eainde.atlas.nodes.ReasoningNode;
import com.eainde.atlas.nodes.ToolDispatchNode;
import org.bsc.langgraph4j.StateGraph;

/**
 * Named states of the travel agent state machine, with the graph node each maps to.
 */
public enum GraphNodeState {
    START(StateGraph.START),
    REASONING(ReasoningNode.NAME),
    TOOL_DISPATCH(ToolDispatchNode.NAME),
    END(StateGraph.END);

    private final String nodeName;

    GraphNodeState(String nodeName) {
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
