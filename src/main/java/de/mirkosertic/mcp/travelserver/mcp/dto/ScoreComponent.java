package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.ranking.FactorScore;

/**
 * One factor of a destination score.
 */
public record ScoreComponent(
        String factor,
        double subScore,
        double weight,
        double contribution,
        String reason
) {
    public static ScoreComponent from(final FactorScore score) {
        return new ScoreComponent(score.factor().key(), round(score.subScore()), score.weight(),
                round(score.contribution()), score.reason());
    }

    private static double round(final double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
