package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the recommend tool.
 */
public record RecommendRequest(
        @Description("Free-text travel wish, e.g. 'budget 5000, adventure, 4 days within 800 km in winter'. "
                + "Budget (single value or range in rupees), moods, duration, distance, months or seasons "
                + "and place names are recognized.")
        String query,

        @Nullable
        @Description("Maximum number of recommendations. Default is 5, maximum is 50.")
        Integer topK,

        @Nullable
        @Description("If true, every recommendation carries its per-factor score breakdown. Default is false.")
        Boolean explain
) {
    public static RecommendRequest fromMap(final Map<String, Object> args) {
        return new RecommendRequest(
                (String) args.get("query"),
                args.get("topK") != null ? ((Number) args.get("topK")).intValue() : null,
                (Boolean) args.get("explain")
        );
    }

    /**
     * Requested result count, or the default when absent. Values above the maximum are capped;
     * values below 1 are passed through so the ranker can reject them.
     */
    public int effectiveTopK(final int defaultTopK, final int maxTopK) {
        return topK != null ? Math.min(topK, maxTopK) : defaultTopK;
    }

    public boolean effectiveExplain() {
        return Boolean.TRUE.equals(explain);
    }
}
