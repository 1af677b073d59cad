package com.eainde.atlas.reasoning;

import com.eainde.atlas.tools.ToolField;
import com.eainde.atlas.tools.ToolManifestEntry;
import com.eainde.atlas.tools.ToolSchema;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts tool manifest entries into langchain4j tool specifications.
 */
public final class ToolSpecificationMapper {

    private ToolSpecificationMapper() {
    }

    public static List<ToolSpecification> toSpecifications(Iterable<ToolManifestEntry> manifest) {
        List<ToolSpecification> specifications = new ArrayList<>();
        for (ToolManifestEntry entry : manifest) {
            specifications.add(toSpecification(entry));
        }
        return specifications;
    }

    public static ToolSpecification toSpecification(ToolManifestEntry entry) {
        return ToolSpecification.builder()
                .name(entry.name())
                .description(entry.description())
                .parameters(toParameters(entry.schema()))
                .build();
    }

    static JsonObjectSchema toParameters(ToolSchema schema) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        for (ToolField field : schema.fields()) {
            builder.addProperty(field.name(), toElement(field));
        }
        List<String> required = schema.requiredNames();
        if (!required.isEmpty()) {
            builder.required(required);
        }
        return builder.build();
    }

    private static JsonSchemaElement toElement(ToolField field) {
        String description = describe(field);
        return switch (field.type()) {
            case STRING -> JsonStringSchema.builder().description(description).build();
            case INTEGER -> JsonIntegerSchema.builder().description(description).build();
            case NUMBER -> JsonNumberSchema.builder().description(description).build();
            case BOOLEAN -> JsonBooleanSchema.builder().description(description).build();
            case ARRAY -> JsonArraySchema.builder().description(description).build();
            case OBJECT -> JsonObjectSchema.builder().description(description).build();
        };
    }

    private static String describe(ToolField field) {
        if (field.defaultValue() == null) {
            return field.description();
        }
        String base = field.description() == null ? "" : field.description() + " ";
        return base + "(default: " + field.defaultValue() + ")";
    }
}
