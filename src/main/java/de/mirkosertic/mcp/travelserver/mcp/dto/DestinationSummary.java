package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.catalog.Destination;

import java.util.List;

/**
 * Catalog entry as shown by listDestinations and addDestination.
 */
public record DestinationSummary(
        int id,
        String name,
        List<String> moods,
        String budget,
        int budgetMin,
        int budgetMax,
        String duration,
        String distance,
        double rating,
        List<String> bestMonths,
        String description
) {
    public static DestinationSummary from(final Destination destination) {
        return new DestinationSummary(
                destination.id(),
                destination.name(),
                destination.moods(),
                destination.formattedBudget(),
                destination.budgetMin(),
                destination.budgetMax(),
                destination.durationDays() + " days",
                destination.distanceKm() + " km",
                destination.rating(),
                destination.bestMonths(),
                destination.description()
        );
    }
}
