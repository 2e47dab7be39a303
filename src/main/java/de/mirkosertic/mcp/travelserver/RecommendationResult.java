package de.mirkosertic.mcp.travelserver;

import de.mirkosertic.mcp.travelserver.catalog.Destination;
import de.mirkosertic.mcp.travelserver.query.QueryConstraints;
import de.mirkosertic.mcp.travelserver.ranking.FactorScore;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of one recommendation query: the ranked entries and the constraints they were ranked by.
 */
public record RecommendationResult(
        String query,
        QueryConstraints constraints,
        List<Entry> entries,
        int totalResults
) {

    public RecommendationResult {
        entries = List.copyOf(entries);
    }

    /**
     * One ranked destination. {@code breakdown} is only set on the explanation path.
     */
    public record Entry(
            int rank,
            int id,
            String name,
            double score,
            List<String> moods,
            int budgetMin,
            int budgetMax,
            String budgetRange,
            int durationDays,
            int distanceKm,
            double rating,
            List<String> bestMonths,
            String description,
            @Nullable List<FactorScore> breakdown
    ) {

        static Entry of(final int rank, final Destination destination, final double score,
                        final @Nullable List<FactorScore> breakdown) {
            return new Entry(rank, destination.id(), destination.name(), roundScore(score), destination.moods(),
                    destination.budgetMin(), destination.budgetMax(), destination.formattedBudget(),
                    destination.durationDays(), destination.distanceKm(), destination.rating(),
                    destination.bestMonths(), destination.description(), breakdown);
        }
    }

    /**
     * Round to four decimal places for presentation.
     */
    static double roundScore(final double score) {
        return Math.round(score * 10_000.0) / 10_000.0;
    }
}
