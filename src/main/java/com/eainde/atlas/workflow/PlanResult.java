package com.eainde.atlas.workflow;

import com.eainde.atlas.execution.RunStatus;
import com.eainde.atlas.format.Itinerary;
import com.eainde.atlas.run.Citation;
import com.eainde.atlas.run.ConversationMessage;
import com.eainde.atlas.run.NodeEvent;
import com.eainde.atlas.run.ToolInvocation;

import java.util.List;

/**
 * Outcome of a completed run.
 */
public record PlanResult(
        String runId,
        RunStatus status,
        String answer,
        Itinerary itinerary,
        List<Citation> citations,
        List<ToolInvocation> toolInvocations,
        List<NodeEvent> timeline,
        List<ConversationMessage> messages,
        int iterations
) {
}
