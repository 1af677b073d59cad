package com.eainde.atlas.workflow;

import com.eainde.atlas.reasoning.ReasoningOutput;

/**
 * Transition function of the agent state machine:
 * {@code START -> REASONING -> (TOOL_DISPATCH -> REASONING)* -> END}.
 * <p>
 * Pure and side-effect free. The iteration bound is enforced by the reasoning node, not here.
 */
public final class GraphRouter {

    private GraphRouter() {
    }

    /**
     * @param output result of the reasoning step, required when {@code current} is
     *               {@link GraphNodeState#REASONING} and ignored otherwise
     */
    public static GraphNodeState nextState(GraphNodeState current, ReasoningOutput output) {
        return switch (current) {
            case START, TOOL_DISPATCH -> GraphNodeState.REASONING;
            case REASONING -> {
                if (output == null) {
                    throw new IllegalArgumentException("Routing out of REASONING needs the reasoning output");
                }
                yield output.isFinal() ? GraphNodeState.END : GraphNodeState.TOOL_DISPATCH;
            }
            case END -> throw new IllegalStateException("END is terminal");
        };
    }
}
