package de.mirkosertic.mcp.travelserver;

import java.util.Map;

/**
 * Size and shape of the currently served catalog.
 *
 * @param destinationCount destinations in the current index generation
 * @param distinctTerms    distinct terms in the reverse index
 * @param moodCounts       number of destinations per mood tag
 * @param generation       index generation, increases with every rebuild
 * @param catalogPath      file the catalog is persisted in
 */
public record CatalogStats(
        int destinationCount,
        int distinctTerms,
        Map<String, Integer> moodCounts,
        long generation,
        String catalogPath
) {
}
