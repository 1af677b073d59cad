package com.eainde.atlas.reasoning;

import com.eainde.atlas.run.ConversationMessage;
import com.eainde.atlas.tools.ToolManifestEntry;

import java.util.List;

/**
 * The opaque language-model decision point. Given the conversation so far and the tools on
 * offer it returns either a final answer or a set of tool requests.
 * <p>
 * Implementations may block; callers bound the call with a timeout.
 */
public interface ReasoningModel {

    /**
     * @throws com.eainde.atlas.error.ReasoningUnavailableException when the model cannot be reached
     */
    ReasoningOutput reason(List<ConversationMessage> history, Iterable<ToolManifestEntry> manifest);
}
