package com.eainde.atlas.tools;

import com.eainde.atlas.error.ToolArgumentsException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered argument schema of a {@link ToolCapability}.
 * <p>
 * {@link #validate(String, Map)} is the only gate between the reasoning step's raw
 * arguments and a capability body: it collects every violation, applies defaults,
 * narrows integral numbers and drops keys the schema does not declare.
 */
@Slf4j
public final class ToolSchema {

    /**
     * Key under which the reasoning adapter passes an argument string it could not parse.
     */
    public static final String RAW_ARGUMENTS = "_raw";

    private static final ToolSchema EMPTY = new ToolSchema(List.of());

    private final List<ToolField> fields;

    private ToolSchema(List<ToolField> fields) {
        this.fields = List.copyOf(fields);
    }

    public static ToolSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ToolField> fields() {
        return fields;
    }

    public List<String> requiredNames() {
        return fields.stream().filter(ToolField::required).map(ToolField::name).toList();
    }

    public Map<String, Object> validate(String toolName, Map<String, Object> rawArguments) {
        Map<String, Object> raw = rawArguments == null ? Map.of() : rawArguments;
        if (raw.containsKey(RAW_ARGUMENTS)) {
            throw new ToolArgumentsException(toolName, List.of("arguments are not valid JSON"));
        }
        List<String> violations = new ArrayList<>();
        Map<String, Object> validated = new LinkedHashMap<>();

        for (ToolField field : fields) {
            Object value = raw.get(field.name());
            if (value == null) {
                if (field.required()) {
                    violations.add("missing required field '" + field.name() + "'");
                } else if (field.defaultValue() != null) {
                    validated.put(field.name(), field.defaultValue());
                }
                continue;
            }
            if (!field.type().accepts(value)) {
                violations.add("field '" + field.name() + "' must be " + field.type().jsonName()
                        + " but was " + value.getClass().getSimpleName());
                continue;
            }
            if (field.type() == FieldType.STRING && field.required() && value.toString().isBlank()) {
                violations.add("field '" + field.name() + "' must not be blank");
                continue;
            }
            validated.put(field.name(), field.type() == FieldType.INTEGER ? narrow(value) : value);
        }

        if (!violations.isEmpty()) {
            throw new ToolArgumentsException(toolName, violations);
        }

        Set<String> declared = new LinkedHashSet<>();
        fields.forEach(f -> declared.add(f.name()));
        raw.keySet().stream()
                .filter(key -> !declared.contains(key))
                .forEach(key -> log.debug("Dropping undeclared argument '{}' for tool {}", key, toolName));

        return Collections.unmodifiableMap(validated);
    }

    private static Object narrow(Object value) {
        long asLong;
        if (value instanceof BigInteger big) {
            asLong = big.longValueExact();
        } else if (value instanceof BigDecimal decimal) {
            asLong = decimal.longValueExact();
        } else {
            asLong = ((Number) value).longValue();
        }
        if (asLong >= Integer.MIN_VALUE && asLong <= Integer.MAX_VALUE) {
            return (int) asLong;
        }
        return asLong;
    }

    @Override
    public String toString() {
        return "ToolSchema" + fields;
    }

    public static final class Builder {

        private final Map<String, ToolField> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder required(String name, FieldType type, String description) {
            return add(new ToolField(name, type, true, description, null));
        }

        public Builder optional(String name, FieldType type, String description) {
            return add(new ToolField(name, type, false, description, null));
        }

        public Builder optional(String name, FieldType type, String description, Object defaultValue) {
            return add(new ToolField(name, type, false, description, defaultValue));
        }

        public Builder add(ToolField field) {
            if (fields.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate schema field: " + field.name());
            }
            return this;
        }

        public ToolSchema build() {
            return fields.isEmpty() ? EMPTY : new ToolSchema(new ArrayList<>(fields.values()));
        }
    }
}
