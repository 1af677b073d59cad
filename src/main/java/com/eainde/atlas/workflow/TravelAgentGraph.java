package com.eainde.atlas.workflow;

import com.eainde.atlas.config.AgentProperties;
import com.eainde.atlas.edges.ReasoningRoutingEdge;
import com.eainde.atlas.nodes.ReasoningNode;
import com.eainde.atlas.nodes.ToolDispatchNode;
import com.eainde.atlas.state.TravelAgentState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

@Component
public class TravelAgentGraph {

    private final ReasoningNode reasoningNode;
    private final ToolDispatchNode toolDispatchNode;
    private final ReasoningRoutingEdge routingEdge;
    private final AgentProperties properties;

    public TravelAgentGraph(ReasoningNode reasoningNode,
                            ToolDispatchNode toolDispatchNode,
                            ReasoningRoutingEdge routingEdge,
                            AgentProperties properties) {
        this.reasoningNode = reasoningNode;
        this.toolDispatchNode = toolDispatchNode;
        this.routingEdge = routingEdge;
        this.properties = properties;
    }

    @Bean("travelAgentWorkflow")
    public CompiledGraph<TravelAgentState> build() throws GraphStateException {
        return build(reasoningNode, toolDispatchNode, routingEdge, properties.getMaxIterations());
    }

    /**
     * START -> reasoning -> (tool_dispatch -> reasoning)* -> END.
     */
    public static CompiledGraph<TravelAgentState> build(ReasoningNode reasoningNode,
                                                        ToolDispatchNode toolDispatchNode,
                                                        ReasoningRoutingEdge routingEdge,
                                                        int maxIterations) throws GraphStateException {
        StateGraph<TravelAgentState> workflow = new StateGraph<>(TravelAgentState::new);

        workflow.addNode(ReasoningNode.NAME, reasoningNode);
        workflow.addNode(ToolDispatchNode.NAME, toolDispatchNode);

        workflow.addEdge(START, ReasoningNode.NAME);
        workflow.addConditionalEdges(
                ReasoningNode.NAME,
                routingEdge,
                Map.of(
                        GraphNodeState.TOOL_DISPATCH.name(), ToolDispatchNode.NAME,
                        GraphNodeState.END.name(), END
                )
        );
        workflow.addEdge(ToolDispatchNode.NAME, ReasoningNode.NAME);

        CompiledGraph<TravelAgentState> compiled = workflow.compile();
        // The reasoning node enforces the cycle bound; keep the runtime's own step limit above it.
        compiled.setMaxIterations(maxIterations * 2 + 3);
        return compiled;
    }
}
