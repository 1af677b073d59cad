package com.eainde.atlas.reasoning;

import com.eainde.atlas.error.ReasoningUnavailableException;
import com.eainde.atlas.run.ConversationMessage;
import com.eainde.atlas.tools.ToolManifestEntry;

import java.util.List;

/**
 * Used when no chat model is configured. Every run fails with
 * {@link ReasoningUnavailableException}.
 */
public class UnavailableReasoningModel implements ReasoningModel {

    private final String reason;

    public UnavailableReasoningModel(String reason) {
        this.reason = reason;
    }

    @Override
    public ReasoningOutput reason(List<ConversationMessage> history, Iterable<ToolManifestEntry> manifest) {
        throw new ReasoningUnavailableException(reason);
    }
}
