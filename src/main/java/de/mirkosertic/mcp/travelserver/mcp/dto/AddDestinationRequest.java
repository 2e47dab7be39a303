package de.mirkosertic.mcp.travelserver.mcp.dto;

import de.mirkosertic.mcp.travelserver.catalog.DestinationDraft;
import de.mirkosertic.mcp.travelserver.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for the addDestination tool.
 */
public record AddDestinationRequest(
        @Description("Display name, e.g. 'Munnar Tea Hills'")
        String name,

        @Description("Mood tags such as adventure, nature, relaxing, party, cultural, history, spiritual, romantic")
        List<String> moods,

        @Description("Lowest expected trip cost in rupees")
        Integer budgetMin,

        @Description("Highest expected trip cost in rupees, not lower than budgetMin")
        Integer budgetMax,

        @Description("Typical trip length in days")
        Integer durationDays,

        @Description("Travel distance in kilometers")
        Integer distanceKm,

        @Description("Rating between 0 and 5")
        Double rating,

        @Nullable
        @Description("Best months to visit, lowercase full month names")
        List<String> bestMonths,

        @Description("Short description used for free-text matching")
        String description
) {
    public static AddDestinationRequest fromMap(final Map<String, Object> args) {
        return new AddDestinationRequest(
                (String) args.get("name"),
                stringList(args.get("moods")),
                intValue(args.get("budgetMin")),
                intValue(args.get("budgetMax")),
                intValue(args.get("durationDays")),
                intValue(args.get("distanceKm")),
                args.get("rating") != null ? ((Number) args.get("rating")).doubleValue() : null,
                stringList(args.get("bestMonths")),
                (String) args.get("description")
        );
    }

    public DestinationDraft toDraft() {
        return new DestinationDraft(name, moods, budgetMin, budgetMax, durationDays, distanceKm, rating,
                bestMonths, description);
    }

    private static @Nullable Integer intValue(final @Nullable Object value) {
        return value != null ? ((Number) value).intValue() : null;
    }

    private static @Nullable List<String> stringList(final @Nullable Object value) {
        if (!(value instanceof List<?> raw)) {
            return null;
        }
        final List<String> result = new ArrayList<>(raw.size());
        for (final Object item : raw) {
            if (item != null) {
                result.add(item.toString().trim());
            }
        }
        return result;
    }
}
