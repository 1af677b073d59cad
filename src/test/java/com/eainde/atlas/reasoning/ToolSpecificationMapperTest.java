package com.eainde.atlas.reasoning;

import com.eainde.atlas.tools.FieldType;
import com.eainde.atlas.tools.ToolManifestEntry;
import com.eainde.atlas.tools.ToolSchema;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolSpecificationMapperTest {

    private final ToolSchema schema = ToolSchema.builder()
            .required("location", FieldType.STRING, "City name")
            .optional("days", FieldType.INTEGER, "Number of days", 7)
            .build();

    @Test
    @DisplayName("maps fields to typed properties and keeps the required list")
    void mapsSchema() {
        JsonObjectSchema parameters = ToolSpecificationMapper.toParameters(schema);

        assertThat(parameters.properties()).containsOnlyKeys("location", "days");
        assertThat(parameters.properties().get("location")).isInstanceOf(JsonStringSchema.class);
        assertThat(parameters.properties().get("days")).isInstanceOfSatisfying(JsonIntegerSchema.class,
                days -> assertThat(days.description()).isEqualTo("Number of days (default: 7)"));
        assertThat(parameters.required()).containsExactly("location");
    }

    @Test
    @DisplayName("builds a named specification from a manifest entry")
    void specification() {
        ToolSpecification specification = ToolSpecificationMapper.toSpecification(
                new ToolManifestEntry("get_weather", "Weather forecast", schema));

        assertThat(specification.name()).isEqualTo("get_weather");
        assertThat(specification.description()).isEqualTo("Weather forecast");
        assertThat(specification.parameters().properties()).hasSize(2);
    }

    @Test
    @DisplayName("an empty schema has no required fields")
    void emptySchema() {
        assertThat(ToolSpecificationMapper.toParameters(ToolSchema.empty()).required()).isNullOrEmpty();
    }
}
