package com.eainde.atlas.tools.builtin;

import com.eainde.atlas.error.ToolArgumentsException;
import com.eainde.atlas.tools.SourceAttribution;
import com.eainde.atlas.tools.ToolResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnowledgeBaseToolTest {

    private final KnowledgeBaseTool tool = new KnowledgeBaseTool();

    private ToolResult call(Map<String, Object> raw) {
        return tool.execute(tool.schema().validate(tool.name(), raw)).join();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> results(ToolResult result) {
        return (List<Map<String, Object>>) ((Map<String, Object>) result.payload()).get("results");
    }

    @Test
    @DisplayName("returns matching passages with chunk metadata and credits each one")
    @SuppressWarnings("unchecked")
    void matchingPassage() {
        ToolResult result = call(Map.of("query", "Jeronimos Monastery tickets Belem"));

        assertThat(result.success()).isTrue();
        assertThat(results(result)).singleElement().satisfies(chunk -> {
            assertThat(chunk).containsEntry("title", "Lisbon City Guide")
                    .containsEntry("chunk_index", 1)
                    .containsEntry("similarity", 1.0)
                    .containsKeys("chunk_text", "source_type", "token_count");
            assertThat((String) chunk.get("chunk_text")).contains("12 EUR");
        });
        assertThat(result.payload()).isInstanceOf(Map.class);
        assertThat((Map<String, Object>) result.payload())
                .containsEntry("total_results", 1)
                .containsEntry("message", "Found 1 relevant knowledge items");
        assertThat(result.sources()).extracting(SourceAttribution::source)
                .containsExactly("knowledge:Lisbon City Guide#1");
    }

    @Test
    @DisplayName("orders by similarity and honours the limit")
    void orderedAndLimited() {
        ToolResult all = call(Map.of("query", "Paris museum pass Louvre"));
        ToolResult one = call(Map.of("query", "Paris museum pass Louvre", "limit", 1));

        assertThat(results(all)).extracting(chunk -> chunk.get("title"))
                .containsExactly("Paris Museum Pass", "Seasonal Travel Notes");
        assertThat(results(one)).extracting(chunk -> chunk.get("title")).containsExactly("Paris Museum Pass");
        assertThat(one.sources()).hasSize(1);
    }

    @Test
    @DisplayName("no match is an empty successful result without sources")
    void noMatch() {
        ToolResult result = call(Map.of("query", "snorkeling Maldives"));

        assertThat(result.success()).isTrue();
        assertThat(results(result)).isEmpty();
        assertThat(result.sources()).isEmpty();
    }

    @Test
    @DisplayName("an out-of-range limit is a failed result")
    void badLimit() {
        ToolResult result = call(Map.of("query", "Lisbon", "limit", 0));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("limit");
    }

    @Test
    @DisplayName("query is required")
    void missingQuery() {
        assertThatThrownBy(() -> tool.schema().validate(tool.name(), Map.of("limit", 3)))
                .isInstanceOf(ToolArgumentsException.class)
                .hasMessageContaining("query");
    }
}
