package de.mirkosertic.mcp.travelserver.ranking;

import de.mirkosertic.mcp.travelserver.catalog.Destination;
import org.jspecify.annotations.Nullable;

/**
 * One ranking result. {@code explanation} is only present when it was requested.
 */
public record RankedDestination(
        Destination destination,
        double score,
        @Nullable ScoreExplanation explanation
) {
}
