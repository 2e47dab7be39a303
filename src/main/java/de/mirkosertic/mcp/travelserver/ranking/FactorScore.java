package de.mirkosertic.mcp.travelserver.ranking;

/**
 * Contribution of one factor to a destination score.
 *
 * @param factor       the factor
 * @param subScore     raw sub-score, roughly 0..1 (the budget may exceed 1.0)
 * @param weight       weight applied for this query
 * @param contribution {@code subScore * weight}
 * @param reason       human-readable explanation
 */
public record FactorScore(
        ScoreFactor factor,
        double subScore,
        double weight,
        double contribution,
        String reason
) {

    static FactorScore of(final ScoreFactor factor, final double subScore, final double weight, final String reason) {
        return new FactorScore(factor, subScore, weight, subScore * weight, reason);
    }
}
