package com.eainde.atlas.reasoning;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs latency and token use of every chat model call.
 */
@Slf4j
public class ChatModelLoggingListener implements ChatModelListener {

    static final String START_NANOS = "atlas.startNanos";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        requestContext.attributes().put(START_NANOS, System.nanoTime());
        if (log.isDebugEnabled()) {
            log.debug("Chat request with {} message(s) and {} tool(s)",
                    requestContext.chatRequest().messages().size(),
                    requestContext.chatRequest().toolSpecifications() == null
                            ? 0 : requestContext.chatRequest().toolSpecifications().size());
        }
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object started = responseContext.attributes().get(START_NANOS);
        long millis = started instanceof Long nanos ? (System.nanoTime() - nanos) / 1_000_000 : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            log.info("Chat model responded in {}ms (tokens in={}, out={}, total={})",
                    millis, usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
        } else {
            log.info("Chat model responded in {}ms", millis);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("Chat model call failed", errorContext.error());
    }
}
