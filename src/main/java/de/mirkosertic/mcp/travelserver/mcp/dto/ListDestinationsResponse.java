package de.mirkosertic.mcp.travelserver.mcp.dto;

import java.util.List;

/**
 * Response DTO for the listDestinations tool.
 */
public record ListDestinationsResponse(
        boolean success,
        List<DestinationSummary> destinations,
        int totalCount,
        String error
) {
    public static ListDestinationsResponse success(final List<DestinationSummary> destinations) {
        return new ListDestinationsResponse(true, destinations, destinations.size(), null);
    }

    public static ListDestinationsResponse error(final String errorMessage) {
        return new ListDestinationsResponse(false, null, 0, errorMessage);
    }
}
