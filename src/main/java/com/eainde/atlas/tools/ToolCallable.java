package com.eainde.atlas.tools;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Ready-to-invoke form of a registered capability: validates raw arguments against the
 * capability schema, then executes it.
 */
@FunctionalInterface
public interface ToolCallable {

    /**
     * @throws com.eainde.atlas.error.ToolArgumentsException when validation fails; the
     *         capability body is not invoked in that case
     */
    CompletableFuture<ToolResult> invoke(Map<String, Object> rawArguments);
}
