package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the removeDestination tool.
 */
public record RemoveDestinationRequest(
        @Description("Id of the destination to remove")
        Integer destinationId
) {
    public static RemoveDestinationRequest fromMap(final Map<String, Object> args) {
        return new RemoveDestinationRequest(
                args.get("destinationId") != null ? ((Number) args.get("destinationId")).intValue() : null);
    }
}
