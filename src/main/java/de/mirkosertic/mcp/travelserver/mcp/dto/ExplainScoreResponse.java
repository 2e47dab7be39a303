package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.ranking.FactorScore;
import de.mirkosertic.mcp.travelserver.ranking.ScoreExplanation;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for the explainScore tool.
 */
public record ExplainScoreResponse(
        boolean success,
        Integer destinationId,
        String destinationName,
        Double totalScore,
        Boolean rejected,
        String rejectionReason,
        Boolean aboveThreshold,
        List<ScoreComponent> components,
        String error
) {
    public static ExplainScoreResponse success(final ScoreExplanation explanation) {
        final List<ScoreComponent> components = new ArrayList<>(explanation.factors().size());
        for (final FactorScore factor : explanation.factors()) {
            components.add(ScoreComponent.from(factor));
        }
        return new ExplainScoreResponse(true, explanation.destination().id(), explanation.destination().name(),
                Math.round(explanation.totalScore() * 10_000.0) / 10_000.0, explanation.rejected(),
                explanation.rejectionReason(), explanation.aboveThreshold(), components, null);
    }

    public static ExplainScoreResponse error(final String errorMessage) {
        return new ExplainScoreResponse(false, null, null, null, null, null, null, null, errorMessage);
    }
}
