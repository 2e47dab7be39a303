package de.mirkosertic.mcp.travelserver.catalog;

import java.util.List;
import java.util.Locale;

/**
 * A single travel catalog entry.
 * <p>
 * Instances are created when the catalog is loaded and are never modified afterwards.
 * A catalog change replaces the whole set of destinations.
 */
public record Destination(
        int id,
        String name,
        List<String> moods,
        int budgetMin,
        int budgetMax,
        int durationDays,
        int distanceKm,
        double rating,
        List<String> bestMonths,
        String description
) {

    public Destination {
        moods = List.copyOf(moods);
        bestMonths = List.copyOf(bestMonths);
    }

    /**
     * Budget range formatted for display, e.g. {@code ₹2500-5000}.
     */
    public String formattedBudget() {
        return "₹" + budgetMin + "-" + budgetMax;
    }

    public boolean hasMood(final String mood) {
        for (final String own : moods) {
            if (own.equalsIgnoreCase(mood)) {
                return true;
            }
        }
        return false;
    }

    public boolean isBestIn(final String month) {
        for (final String own : bestMonths) {
            if (own.toLowerCase(Locale.ROOT).equals(month)) {
                return true;
            }
        }
        return false;
    }
}
