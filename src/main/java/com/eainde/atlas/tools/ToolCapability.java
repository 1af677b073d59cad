package com.eainde.atlas.tools;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A named, schema-validated action the reasoning step can request.
 * <p>
 * Implementations are constructed once at startup, registered in a {@link ToolRegistry} and
 * never mutated afterwards. {@link #execute(Map)} only ever receives arguments that passed
 * {@link ToolSchema#validate(String, Map)}.
 */
public interface ToolCapability {

    String name();

    String description();

    ToolSchema schema();

    /**
     * Runs the capability. A failed outcome may be reported either as
     * {@link ToolResult#failure(String)} or as an exceptionally completed future.
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> validatedArguments);
}
