package com.eainde.atlas.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One tool invocation requested by the reasoning step.
 *
 * @param id        call identifier, unique within the run
 * @param name      requested capability name, possibly unregistered
 * @param arguments raw, unvalidated arguments
 */
public record ToolCallRequest(String id, String name, Map<String, Object> arguments) {

    public ToolCallRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
