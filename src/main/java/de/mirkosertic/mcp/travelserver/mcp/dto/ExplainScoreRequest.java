package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the explainScore tool.
 */
public record ExplainScoreRequest(
        @Description("The free-text query to score the destination against")
        String query,

        @Description("Id of the destination to explain, as returned by recommend or listDestinations")
        Integer destinationId
) {
    public static ExplainScoreRequest fromMap(final Map<String, Object> args) {
        return new ExplainScoreRequest(
                (String) args.get("query"),
                args.get("destinationId") != null ? ((Number) args.get("destinationId")).intValue() : null
        );
    }
}
