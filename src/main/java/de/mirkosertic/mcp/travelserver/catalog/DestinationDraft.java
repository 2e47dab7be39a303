package de.mirkosertic.mcp.travelserver.catalog;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A destination submitted for addition to the catalog, before an id has been assigned.
 */
public record DestinationDraft(
        @Nullable String name,
        @Nullable List<String> moods,
        @Nullable Integer budgetMin,
        @Nullable Integer budgetMax,
        @Nullable Integer durationDays,
        @Nullable Integer distanceKm,
        @Nullable Double rating,
        @Nullable List<String> bestMonths,
        @Nullable String description
) {

    /**
     * Check that all required values are present and consistent.
     *
     * @throws IllegalArgumentException describing every missing field, or the first inconsistent value
     */
    public void validate() {
        final List<String> missing = new ArrayList<>();
        if (name == null || name.isBlank()) {
            missing.add("name");
        }
        if (moods == null || moods.isEmpty()) {
            missing.add("moods");
        }
        if (budgetMin == null) {
            missing.add("budgetMin");
        }
        if (budgetMax == null) {
            missing.add("budgetMax");
        }
        if (durationDays == null) {
            missing.add("durationDays");
        }
        if (distanceKm == null) {
            missing.add("distanceKm");
        }
        if (rating == null) {
            missing.add("rating");
        }
        if (description == null || description.isBlank()) {
            missing.add("description");
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Missing required fields: " + String.join(", ", missing));
        }

        if (budgetMin > budgetMax) {
            throw new IllegalArgumentException("budgetMin cannot be greater than budgetMax");
        }
        if (durationDays < 0 || distanceKm < 0) {
            throw new IllegalArgumentException("durationDays and distanceKm must not be negative");
        }
        if (rating < 0.0 || rating > 5.0) {
            throw new IllegalArgumentException("rating must be between 0 and 5");
        }
    }

    /**
     * Create the catalog record for this draft. Call {@link #validate()} first.
     */
    public Destination toDestination(final int id) {
        return new Destination(
                id,
                name.strip(),
                moods,
                budgetMin,
                budgetMax,
                durationDays,
                distanceKm,
                rating,
                bestMonths != null ? bestMonths : List.of(),
                description.strip()
        );
    }
}
