package com.eainde.atlas.tools;

import java.util.Objects;

/**
 * One named argument of a tool schema.
 *
 * @param name         argument name as the reasoning step must send it
 * @param type         expected JSON type
 * @param required     whether the argument must be present
 * @param description  human-readable description offered to the reasoning step
 * @param defaultValue value applied when an optional argument is absent, may be null
 */
public record ToolField(String name, FieldType type, boolean required, String description, Object defaultValue) {

    public ToolField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (defaultValue != null && !type.accepts(defaultValue)) {
            throw new IllegalArgumentException(
                    "Default value for '" + name + "' is not a " + type.jsonName());
        }
    }
}
