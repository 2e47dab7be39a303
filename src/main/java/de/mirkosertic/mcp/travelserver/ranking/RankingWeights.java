package de.mirkosertic.mcp.travelserver.ranking;

/**
 * Tunable parameters of {@link DestinationRanker}.
 * <p>
 * The defaults are golden values that pin the current ranking behaviour. They have no derivation
 * beyond that, so they live in configuration rather than in code.
 *
 * @param budget             weight of the budget fit
 * @param mood               weight of the mood overlap
 * @param durationGiven      weight of the duration fit when the query names a duration
 * @param durationDefault    weight of the duration factor when it does not
 * @param textMatch          weight of the free-text match against name, moods and description
 * @param category           weight of the destination category derived from the name
 * @param months             weight of the best-months overlap
 * @param distance           weight of the distance fit
 * @param relevanceThreshold results scoring below this are cut off
 * @param affordabilityBonus maximum bonus on top of a full budget score for cheap destinations
 * @param typeMatchFloor     type keywords in the query reject destinations matching them below this score
 */
public record RankingWeights(
        double budget,
        double mood,
        double durationGiven,
        double durationDefault,
        double textMatch,
        double category,
        double months,
        double distance,
        double relevanceThreshold,
        double affordabilityBonus,
        double typeMatchFloor
) {

    public static final double DEFAULT_BUDGET = 0.25;
    public static final double DEFAULT_MOOD = 0.20;
    public static final double DEFAULT_DURATION_GIVEN = 0.20;
    public static final double DEFAULT_DURATION_DEFAULT = 0.03;
    public static final double DEFAULT_TEXT_MATCH = 0.15;
    public static final double DEFAULT_CATEGORY = 0.12;
    public static final double DEFAULT_MONTHS = 0.05;
    public static final double DEFAULT_DISTANCE = 0.03;
    public static final double DEFAULT_RELEVANCE_THRESHOLD = 0.4;
    public static final double DEFAULT_AFFORDABILITY_BONUS = 0.1;
    public static final double DEFAULT_TYPE_MATCH_FLOOR = 0.3;

    private static final double SUM_TOLERANCE = 1e-6;

    public RankingWeights {
        requireNonNegative("budget", budget);
        requireNonNegative("mood", mood);
        requireNonNegative("durationGiven", durationGiven);
        requireNonNegative("durationDefault", durationDefault);
        requireNonNegative("textMatch", textMatch);
        requireNonNegative("category", category);
        requireNonNegative("months", months);
        requireNonNegative("distance", distance);
        requireNonNegative("relevanceThreshold", relevanceThreshold);
        requireNonNegative("affordabilityBonus", affordabilityBonus);
        if (typeMatchFloor < 0.0 || typeMatchFloor > 1.0) {
            throw new IllegalArgumentException("typeMatchFloor must be between 0 and 1, got " + typeMatchFloor);
        }
    }

    public static RankingWeights defaults() {
        return new RankingWeights(DEFAULT_BUDGET, DEFAULT_MOOD, DEFAULT_DURATION_GIVEN, DEFAULT_DURATION_DEFAULT,
                DEFAULT_TEXT_MATCH, DEFAULT_CATEGORY, DEFAULT_MONTHS, DEFAULT_DISTANCE,
                DEFAULT_RELEVANCE_THRESHOLD, DEFAULT_AFFORDABILITY_BONUS, DEFAULT_TYPE_MATCH_FLOOR);
    }

    /**
     * Sum of all factor weights for a query that names a duration.
     */
    public double totalWithDuration() {
        return budget + mood + durationGiven + textMatch + category + months + distance;
    }

    /**
     * Whether the factor weights sum to 1.0 for a query that names a duration. The relevance
     * threshold is calibrated against that scale.
     */
    public boolean isNormalized() {
        return Math.abs(totalWithDuration() - 1.0) <= SUM_TOLERANCE;
    }

    private static void requireNonNegative(final String name, final double value) {
        if (value < 0.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }
}
