package de.mirkosertic.mcp.travelserver.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Wraps tool response records into MCP results.
 * <p>
 * The record is serialized as JSON text content. A response whose {@code success} property is
 * false is flagged as an error result.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    public static McpSchema.CallToolResult createResult(final Object response) {
        final JsonNode tree;
        try {
            tree = OBJECT_MAPPER.valueToTree(response);
        } catch (final IllegalArgumentException e) {
            logger.error("Could not serialize {}", response.getClass().getSimpleName(), e);
            return createErrorResult("JSON serialization error: " + e.getMessage());
        }
        final JsonNode success = tree.path("success");
        final boolean error = success.isBoolean() && !success.booleanValue();
        return textResult(toJson(tree), error);
    }

    public static McpSchema.CallToolResult createErrorResult(final String errorMessage) {
        final ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("success", false);
        node.put("error", errorMessage);
        return textResult(toJson(node), true);
    }

    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            logger.error("Could not serialize {}", value.getClass().getSimpleName(), e);
            final ObjectNode node = OBJECT_MAPPER.createObjectNode();
            node.put("success", false);
            node.put("error", "JSON serialization error: " + e.getOriginalMessage());
            return node.toString();
        }
    }

    private static McpSchema.CallToolResult textResult(final String json, final boolean error) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(json)))
                .isError(error)
                .build();
    }
}
