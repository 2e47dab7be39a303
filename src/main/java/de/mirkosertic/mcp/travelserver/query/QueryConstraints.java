package de.mirkosertic.mcp.travelserver.query;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured constraints parsed from a single free-text query.
 * <p>
 * Every field defaults to "unconstrained": {@code null} for the optional scalars, empty for the
 * collections. {@code budgetInferred} is true when the ceiling was derived from a keyword such as
 * "cheap" rather than from a number in the query.
 */
public record QueryConstraints(
        @Nullable Integer budgetMin,
        @Nullable Integer budgetMax,
        boolean budgetInferred,
        Set<String> moods,
        @Nullable Integer durationDays,
        @Nullable Integer distanceKm,
        @Nullable String placeName,
        Set<String> bestMonths,
        List<String> searchTerms
) {

    public QueryConstraints {
        moods = Collections.unmodifiableSet(new LinkedHashSet<>(moods));
        bestMonths = Collections.unmodifiableSet(new LinkedHashSet<>(bestMonths));
        searchTerms = List.copyOf(searchTerms);
    }

    public static QueryConstraints unconstrained() {
        return new QueryConstraints(null, null, false, Set.of(), null, null, null, Set.of(), List.of());
    }

    /**
     * True when both ends of a budget range were given.
     */
    public boolean hasBudgetRange() {
        return budgetMin != null && budgetMax != null;
    }

    public boolean hasBudgetCeiling() {
        return budgetMax != null;
    }

    public boolean hasDuration() {
        return durationDays != null;
    }

    public boolean hasDistance() {
        return distanceKm != null;
    }
}
