package com.eainde.atlas.workflow;

import com.eainde.atlas.reasoning.ReasoningOutput;
import com.eainde.atlas.run.ToolCallRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphRouterTest {

    private static final ReasoningOutput FINAL = ReasoningOutput.finalAnswer("done");
    private static final ReasoningOutput TOOLS = ReasoningOutput.toolRequests(
            List.of(new ToolCallRequest("c1", "get_weather", Map.of())));

    @Test
    @DisplayName("START and TOOL_DISPATCH always lead to REASONING")
    void intoReasoning() {
        assertThat(GraphRouter.nextState(GraphNodeState.START, null)).isEqualTo(GraphNodeState.REASONING);
        assertThat(GraphRouter.nextState(GraphNodeState.TOOL_DISPATCH, null)).isEqualTo(GraphNodeState.REASONING);
    }

    @Test
    @DisplayName("REASONING ends on a final answer and dispatches on tool requests")
    void outOfReasoning() {
        assertThat(GraphRouter.nextState(GraphNodeState.REASONING, FINAL)).isEqualTo(GraphNodeState.END);
        assertThat(GraphRouter.nextState(GraphNodeState.REASONING, TOOLS)).isEqualTo(GraphNodeState.TOOL_DISPATCH);
    }

    @Test
    @DisplayName("a reply with text and tool requests is not final")
    void textWithTools() {
        ReasoningOutput output = new ReasoningOutput("checking the weather first", TOOLS.toolRequests());

        assertThat(GraphRouter.nextState(GraphNodeState.REASONING, output)).isEqualTo(GraphNodeState.TOOL_DISPATCH);
    }

    @Test
    @DisplayName("END is terminal and REASONING needs an output")
    void invalidTransitions() {
        assertThatThrownBy(() -> GraphRouter.nextState(GraphNodeState.END, FINAL))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> GraphRouter.nextState(GraphNodeState.REASONING, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("states map onto the graph's node names")
    void nodeNames() {
        assertThat(GraphNodeState.REASONING.nodeName()).isEqualTo("reasoning");
        assertThat(GraphNodeState.TOOL_DISPATCH.nodeName()).isEqualTo("tool_dispatch");
    }
}
