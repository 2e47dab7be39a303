package de.mirkosertic.mcp.travelserver.index;

/**
 * Statistics for a single indexed term.
 */
public record TermStatistics(
        String term,
        int documentFrequency,        // number of destinations containing this term
        int totalDestinations,
        double idf,                   // inverse document frequency
        String rarity                 // "absent", "very common", "common", "uncommon", "rare"
) {

    static String rarityOf(final int documentFrequency, final int totalDestinations) {
        if (documentFrequency == 0 || totalDestinations == 0) {
            return "absent";
        }
        final double ratio = (double) documentFrequency / totalDestinations;
        if (ratio > 0.5) {
            return "very common";
        }
        if (ratio > 0.2) {
            return "common";
        }
        if (ratio > 0.05) {
            return "uncommon";
        }
        return "rare";
    }
}
