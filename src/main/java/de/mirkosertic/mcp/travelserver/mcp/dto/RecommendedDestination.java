package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.RecommendationResult;
import de.mirkosertic.mcp.travelserver.ranking.FactorScore;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A single recommendation in a {@link RecommendResponse}.
 */
public record RecommendedDestination(
        int rank,
        int id,
        String name,
        double score,
        List<String> moods,
        String budget,
        int budgetMin,
        int budgetMax,
        int durationDays,
        int distanceKm,
        double rating,
        List<String> bestMonths,
        String description,
        @Nullable List<ScoreComponent> scoreBreakdown
) {
    public static RecommendedDestination from(final RecommendationResult.Entry entry) {
        final List<FactorScore> breakdown = entry.breakdown();
        List<ScoreComponent> components = null;
        if (breakdown != null) {
            components = new ArrayList<>(breakdown.size());
            for (final FactorScore factor : breakdown) {
                components.add(ScoreComponent.from(factor));
            }
        }
        return new RecommendedDestination(entry.rank(), entry.id(), entry.name(), entry.score(), entry.moods(),
                entry.budgetRange(), entry.budgetMin(), entry.budgetMax(), entry.durationDays(), entry.distanceKm(),
                entry.rating(), entry.bestMonths(), entry.description(), components);
    }
}
