package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.CatalogStats;

import java.util.Map;

/**
 * Response DTO for the getCatalogStats tool.
 */
public record CatalogStatsResponse(
        boolean success,
        int destinationCount,
        int distinctTerms,
        Map<String, Integer> moodCounts,
        long indexGeneration,
        String catalogPath,
        String softwareVersion,
        String buildTimestamp,
        String error
) {
    public static CatalogStatsResponse success(final CatalogStats stats, final String softwareVersion,
                                               final String buildTimestamp) {
        return new CatalogStatsResponse(true, stats.destinationCount(), stats.distinctTerms(), stats.moodCounts(),
                stats.generation(), stats.catalogPath(), softwareVersion, buildTimestamp, null);
    }

    public static CatalogStatsResponse error(final String errorMessage) {
        return new CatalogStatsResponse(false, 0, 0, null, 0, null, null, null, errorMessage);
    }
}
