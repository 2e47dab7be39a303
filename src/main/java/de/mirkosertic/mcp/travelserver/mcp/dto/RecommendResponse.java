package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.RecommendationResult;
import de.mirkosertic.mcp.travelserver.query.QueryConstraints;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for the recommend tool.
 */
public record RecommendResponse(
        boolean success,
        String query,
        QueryConstraints parsedConstraints,
        List<RecommendedDestination> recommendations,
        int totalResults,
        long searchTimeMs,
        String error
) {
    public static RecommendResponse success(final RecommendationResult result, final long searchTimeMs) {
        final List<RecommendedDestination> recommendations = new ArrayList<>(result.entries().size());
        for (final RecommendationResult.Entry entry : result.entries()) {
            recommendations.add(RecommendedDestination.from(entry));
        }
        return new RecommendResponse(true, result.query(), result.constraints(), recommendations,
                result.totalResults(), searchTimeMs, null);
    }

    public static RecommendResponse error(final String errorMessage) {
        return new RecommendResponse(false, null, null, null, 0, 0, errorMessage);
    }
}
