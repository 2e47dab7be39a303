package de.mirkosertic.mcp.travelserver.mcp.dto;

/**
 * Response DTO for the addDestination tool.
 */
public record AddDestinationResponse(
        boolean success,
        DestinationSummary destination,
        Integer totalDestinations,
        String error
) {
    public static AddDestinationResponse success(final DestinationSummary destination, final int totalDestinations) {
        return new AddDestinationResponse(true, destination, totalDestinations, null);
    }

    public static AddDestinationResponse error(final String errorMessage) {
        return new AddDestinationResponse(false, null, null, errorMessage);
    }
}
