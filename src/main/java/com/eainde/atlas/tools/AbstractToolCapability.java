package com.eainde.atlas.tools;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for synchronous capability bodies. Subclasses implement {@link #invoke(Map)};
 * any exception it throws is turned into a failed {@link ToolResult}.
 */
@Slf4j
public abstract class AbstractToolCapability implements ToolCapability {

    private final String name;
    private final String description;
    private final ToolSchema schema;

    protected AbstractToolCapability(String name, String description, ToolSchema schema) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final String description() {
        return description;
    }

    @Override
    public final ToolSchema schema() {
        return schema;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> validatedArguments) {
        try {
            return CompletableFuture.completedFuture(invoke(validatedArguments));
        } catch (RuntimeException e) {
            log.error("Tool {} failed with args {}", name, validatedArguments, e);
            return CompletableFuture.completedFuture(ToolResult.failure(e.getMessage()));
        }
    }

    protected abstract ToolResult invoke(Map<String, Object> arguments);

    protected static String stringArg(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        return value == null ? null : value.toString();
    }

    protected static int intArg(Map<String, Object> arguments, String key) {
        return ((Number) arguments.get(key)).intValue();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
