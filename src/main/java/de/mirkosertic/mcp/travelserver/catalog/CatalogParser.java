package de.mirkosertic.mcp.travelserver.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts between the catalog JSON document and {@link Destination} records.
 * <p>
 * The document is an object with a single {@code travel_spots} array. Every entry must carry
 * {@code id}, {@code name}, {@code mood}, {@code budget_min}, {@code budget_max},
 * {@code duration_days}, {@code distance_km}, {@code rating} and {@code description};
 * {@code best_months} is optional and defaults to an empty list.
 */
public final class CatalogParser {

    public static final String ROOT_FIELD = "travel_spots";

    static final String FIELD_ID = "id";
    static final String FIELD_NAME = "name";
    static final String FIELD_MOOD = "mood";
    static final String FIELD_BUDGET_MIN = "budget_min";
    static final String FIELD_BUDGET_MAX = "budget_max";
    static final String FIELD_DURATION_DAYS = "duration_days";
    static final String FIELD_DISTANCE_KM = "distance_km";
    static final String FIELD_RATING = "rating";
    static final String FIELD_BEST_MONTHS = "best_months";
    static final String FIELD_DESCRIPTION = "description";

    private CatalogParser() {
    }

    /**
     * Parse and validate a catalog document.
     *
     * @param root the parsed JSON document (may be null)
     * @return the destinations in document order
     * @throws CatalogFormatException if the top-level shape is wrong or a record is invalid
     */
    public static List<Destination> parse(final JsonNode root) {
        if (root == null || !root.isObject() || !root.has(ROOT_FIELD)) {
            throw new CatalogFormatException("Catalog must be an object containing a '" + ROOT_FIELD + "' field");
        }
        final JsonNode spots = root.get(ROOT_FIELD);
        if (!spots.isArray()) {
            throw new CatalogFormatException("'" + ROOT_FIELD + "' field must contain a list");
        }

        final List<Destination> destinations = new ArrayList<>(spots.size());
        final Set<Integer> seenIds = new HashSet<>();
        int position = 0;
        for (final JsonNode spot : spots) {
            final Destination destination = parseDestination(spot, position);
            if (!seenIds.add(destination.id())) {
                throw new CatalogFormatException("Duplicate destination id " + destination.id()
                        + " at position " + position);
            }
            destinations.add(destination);
            position++;
        }
        return destinations;
    }

    /**
     * Serialize destinations into a catalog document that {@link #parse(JsonNode)} accepts.
     */
    public static ObjectNode toDocument(final ObjectMapper mapper, final List<Destination> destinations) {
        final ObjectNode root = mapper.createObjectNode();
        final ArrayNode spots = root.putArray(ROOT_FIELD);
        for (final Destination destination : destinations) {
            final ObjectNode spot = spots.addObject();
            spot.put(FIELD_ID, destination.id());
            spot.put(FIELD_NAME, destination.name());
            final ArrayNode moods = spot.putArray(FIELD_MOOD);
            destination.moods().forEach(moods::add);
            spot.put(FIELD_BUDGET_MIN, destination.budgetMin());
            spot.put(FIELD_BUDGET_MAX, destination.budgetMax());
            spot.put(FIELD_DURATION_DAYS, destination.durationDays());
            spot.put(FIELD_DISTANCE_KM, destination.distanceKm());
            spot.put(FIELD_RATING, destination.rating());
            final ArrayNode months = spot.putArray(FIELD_BEST_MONTHS);
            destination.bestMonths().forEach(months::add);
            spot.put(FIELD_DESCRIPTION, destination.description());
        }
        return root;
    }

    private static Destination parseDestination(final JsonNode spot, final int position) {
        if (spot == null || !spot.isObject()) {
            throw new CatalogFormatException("Destination at position " + position + " is not an object");
        }

        final int id = requireInt(spot, FIELD_ID, position);
        final String name = requireText(spot, FIELD_NAME, position);
        final List<String> moods = requireTextList(spot, FIELD_MOOD, position);
        final int budgetMin = requireInt(spot, FIELD_BUDGET_MIN, position);
        final int budgetMax = requireInt(spot, FIELD_BUDGET_MAX, position);
        final int durationDays = requireInt(spot, FIELD_DURATION_DAYS, position);
        final int distanceKm = requireInt(spot, FIELD_DISTANCE_KM, position);
        final double rating = requireNumber(spot, FIELD_RATING, position);
        final String description = requireText(spot, FIELD_DESCRIPTION, position);
        final List<String> bestMonths = spot.hasNonNull(FIELD_BEST_MONTHS)
                ? requireTextList(spot, FIELD_BEST_MONTHS, position)
                : List.of();

        if (budgetMin > budgetMax) {
            throw invalid(position, FIELD_BUDGET_MIN, "must not be greater than " + FIELD_BUDGET_MAX);
        }
        if (durationDays < 0) {
            throw invalid(position, FIELD_DURATION_DAYS, "must not be negative");
        }
        if (distanceKm < 0) {
            throw invalid(position, FIELD_DISTANCE_KM, "must not be negative");
        }
        if (rating < 0.0 || rating > 5.0) {
            throw invalid(position, FIELD_RATING, "must be between 0 and 5");
        }

        return new Destination(id, name, moods, budgetMin, budgetMax, durationDays, distanceKm,
                rating, bestMonths, description);
    }

    private static JsonNode require(final JsonNode spot, final String field, final int position) {
        final JsonNode value = spot.get(field);
        if (value == null || value.isNull()) {
            throw new CatalogFormatException("Destination at position " + position
                    + " is missing required field '" + field + "'");
        }
        return value;
    }

    private static int requireInt(final JsonNode spot, final String field, final int position) {
        final JsonNode value = require(spot, field, position);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw invalid(position, field, "must be an integer");
        }
        return value.intValue();
    }

    private static double requireNumber(final JsonNode spot, final String field, final int position) {
        final JsonNode value = require(spot, field, position);
        if (!value.isNumber()) {
            throw invalid(position, field, "must be a number");
        }
        return value.doubleValue();
    }

    private static String requireText(final JsonNode spot, final String field, final int position) {
        final JsonNode value = require(spot, field, position);
        if (!value.isTextual()) {
            throw invalid(position, field, "must be a string");
        }
        return value.textValue();
    }

    private static List<String> requireTextList(final JsonNode spot, final String field, final int position) {
        final JsonNode value = require(spot, field, position);
        if (!value.isArray()) {
            throw invalid(position, field, "must be a list of strings");
        }
        final List<String> items = new ArrayList<>(value.size());
        for (final JsonNode item : value) {
            if (!item.isTextual()) {
                throw invalid(position, field, "must be a list of strings");
            }
            items.add(item.textValue());
        }
        return items;
    }

    private static CatalogFormatException invalid(final int position, final String field, final String problem) {
        return new CatalogFormatException("Destination at position " + position + ": '" + field + "' " + problem);
    }
}
