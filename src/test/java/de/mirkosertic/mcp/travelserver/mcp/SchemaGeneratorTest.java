package de.mirkosertic.mcp.travelserver.mcp;

import de.mirkosertic.mcp.travelserver.mcp.dto.AddDestinationRequest;
import de.mirkosertic.mcp.travelserver.mcp.dto.RecommendRequest;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchemaGenerator")
class SchemaGeneratorTest {

    @Test
    @DisplayName("Nullable components should be optional")
    void nullableIsOptional() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(RecommendRequest.class);

        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.required()).containsExactly("query");
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Property types and descriptions should be derived from the record")
    void propertyTypes() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(AddDestinationRequest.class);

        final Map<String, Object> moods = (Map<String, Object>) schema.properties().get("moods");
        final Map<String, Object> rating = (Map<String, Object>) schema.properties().get("rating");
        final Map<String, Object> budgetMin = (Map<String, Object>) schema.properties().get("budgetMin");

        assertThat(moods).containsEntry("type", "array").containsEntry("items", Map.of("type", "string"));
        assertThat(rating).containsEntry("type", "number");
        assertThat(budgetMin).containsEntry("type", "integer").containsKey("description");
        assertThat(schema.required()).contains("name", "moods").doesNotContain("bestMonths");
    }

    @Test
    @DisplayName("Empty schema should have no properties")
    void emptySchema() {
        assertThat(SchemaGenerator.emptySchema().properties()).isEmpty();
    }

    @Test
    @DisplayName("Java types should map to JSON types")
    void jsonTypes() {
        assertThat(SchemaGenerator.jsonType(String.class)).isEqualTo("string");
        assertThat(SchemaGenerator.jsonType(int.class)).isEqualTo("integer");
        assertThat(SchemaGenerator.jsonType(Double.class)).isEqualTo("number");
        assertThat(SchemaGenerator.jsonType(Boolean.class)).isEqualTo("boolean");
        assertThat(SchemaGenerator.jsonType(Map.class)).isEqualTo("object");
    }
}
