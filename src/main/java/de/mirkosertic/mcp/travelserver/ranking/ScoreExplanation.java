package de.mirkosertic.mcp.travelserver.ranking;

import de.mirkosertic.mcp.travelserver.catalog.Destination;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Per-factor breakdown of a destination score.
 * <p>
 * {@code rejectionReason} is set when the destination would be filtered out of the results by a
 * hard constraint. The factors are still computed in that case.
 */
public record ScoreExplanation(
        Destination destination,
        double totalScore,
        List<FactorScore> factors,
        @Nullable String rejectionReason,
        boolean aboveThreshold
) {

    public ScoreExplanation {
        factors = List.copyOf(factors);
    }

    public boolean rejected() {
        return rejectionReason != null;
    }
}
