package de.mirkosertic.mcp.travelserver.ranking;

import de.mirkosertic.mcp.travelserver.catalog.Destination;
import de.mirkosertic.mcp.travelserver.index.DestinationIndex;
import de.mirkosertic.mcp.travelserver.index.DestinationIndexer;
import de.mirkosertic.mcp.travelserver.query.QueryConstraints;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Scores every destination of the current index snapshot against a set of constraints.
 *
 * <p>The score is a weighted sum of seven factors (see {@link ScoreFactor}). A factor the query
 * does not constrain contributes a neutral 0.5 at its full weight. Two rules are hard filters
 * rather than factors: a budget that cannot be met, and a destination type keyword in the query
 * that the destination does not match. Rejected destinations never appear in the results.</p>
 *
 * <p>Results are ordered by score, then rating, then id. The list is cut at the first score below
 * the relevance threshold and bounded by the requested size, but never padded.</p>
 */
public class DestinationRanker {

    private static final Logger logger = LoggerFactory.getLogger(DestinationRanker.class);

    static final double NEUTRAL = 0.5;

    private static final int NAME_POINTS = 3;
    private static final int MOOD_POINTS = 2;
    private static final int DESCRIPTION_POINTS = 1;

    static final Set<String> TYPE_KEYWORDS = Set.of(
            "mountain", "beach", "hill", "snow", "backwater", "desert", "island", "lake",
            "waterfall", "valley", "fort", "temple");

    private static final List<CategoryTier> CATEGORY_TIERS = List.of(
            new CategoryTier(0.9, List.of("beach", "backwater", "spiritual", "devotion")),
            new CategoryTier(0.85, List.of("hill", "mountain", "snow", "leh", "ladakh", "yoga")),
            new CategoryTier(0.75, List.of("night", "life", "city", "tour")));

    private static final double PLACE_MATCH_SCORE = 1.0;
    private static final double GENERIC_CATEGORY_SCORE = 0.5;

    private static final Comparator<RankedDestination> RESULT_ORDER =
            Comparator.comparingDouble(RankedDestination::score).reversed()
                    .thenComparing(Comparator.comparingDouble(
                            (final RankedDestination r) -> r.destination().rating()).reversed())
                    .thenComparingInt(r -> r.destination().id());

    private final DestinationIndexer indexer;
    private final RankingWeights weights;

    public DestinationRanker(final DestinationIndexer indexer) {
        this(indexer, RankingWeights.defaults());
    }

    public DestinationRanker(final DestinationIndexer indexer, final RankingWeights weights) {
        this.indexer = indexer;
        this.weights = weights;
    }

    public RankingWeights getWeights() {
        return weights;
    }

    public List<RankedDestination> rank(final QueryConstraints constraints, final int hintK) {
        return rank(constraints, hintK, false);
    }

    /**
     * Rank the catalog.
     *
     * @param constraints parsed query
     * @param hintK       maximum number of results
     * @param explain     attach a {@link ScoreExplanation} to every result
     * @throws IllegalArgumentException if {@code hintK} is below 1
     */
    public List<RankedDestination> rank(final QueryConstraints constraints, final int hintK, final boolean explain) {
        if (hintK < 1) {
            throw new IllegalArgumentException("Result count must be at least 1, got " + hintK);
        }

        final DestinationIndex snapshot = indexer.snapshot();
        final List<RankedDestination> candidates = new ArrayList<>();
        int rejected = 0;

        for (final Destination destination : snapshot.getAll()) {
            final OptionalDouble score = score(destination, constraints);
            if (score.isPresent()) {
                candidates.add(new RankedDestination(destination, score.getAsDouble(), null));
            } else {
                rejected++;
            }
        }

        candidates.sort(RESULT_ORDER);

        final List<RankedDestination> results = new ArrayList<>();
        for (final RankedDestination candidate : candidates) {
            if (candidate.score() < weights.relevanceThreshold() || results.size() >= hintK) {
                break;
            }
            results.add(explain
                    ? new RankedDestination(candidate.destination(), candidate.score(),
                    explain(candidate.destination(), constraints))
                    : candidate);
        }

        logger.debug("Ranked generation {}: {} destinations, {} rejected, {} returned",
                snapshot.generation(), snapshot.totalDestinations(), rejected, results.size());
        return results;
    }

    /**
     * Recompute every factor for one destination. Purely diagnostic; the destination is explained
     * even when the ranking would reject it.
     *
     * @return empty if no destination with that id exists
     */
    public Optional<ScoreExplanation> explainScore(final int destinationId, final QueryConstraints constraints) {
        return indexer.snapshot().getById(destinationId).map(d -> explain(d, constraints));
    }

    OptionalDouble score(final Destination destination, final QueryConstraints constraints) {
        if (budgetRejection(destination, constraints) != null) {
            return OptionalDouble.empty();
        }
        final double textScore = textMatchScore(destination, constraints.searchTerms());
        if (typeRejection(destination, constraints) != null) {
            return OptionalDouble.empty();
        }

        final double total = weights.budget() * budgetScore(destination, constraints)
                + weights.mood() * moodScore(destination, constraints)
                + durationWeight(constraints) * durationScore(destination, constraints)
                + weights.textMatch() * textScore
                + weights.category() * categoryScore(destination, constraints)
                + weights.months() * monthsScore(destination, constraints)
                + weights.distance() * distanceScore(destination, constraints);
        return OptionalDouble.of(total);
    }

    ScoreExplanation explain(final Destination destination, final QueryConstraints constraints) {
        final List<FactorScore> factors = List.of(
                FactorScore.of(ScoreFactor.BUDGET, budgetScore(destination, constraints), weights.budget(),
                        budgetReason(destination, constraints)),
                FactorScore.of(ScoreFactor.MOOD, moodScore(destination, constraints), weights.mood(),
                        constraints.moods().isEmpty()
                                ? "No mood specified (neutral score)"
                                : "Moods " + destination.moods() + ", you want " + constraints.moods()),
                FactorScore.of(ScoreFactor.DURATION, durationScore(destination, constraints),
                        durationWeight(constraints),
                        constraints.durationDays() == null
                                ? "No duration specified (neutral score)"
                                : "Duration " + destination.durationDays() + " days, you have "
                                + constraints.durationDays() + " days"),
                FactorScore.of(ScoreFactor.TEXT_MATCH, textMatchScore(destination, constraints.searchTerms()),
                        weights.textMatch(),
                        constraints.searchTerms().isEmpty()
                                ? "No search terms (neutral score)"
                                : "Search terms " + constraints.searchTerms() + " against name, moods and description"),
                FactorScore.of(ScoreFactor.CATEGORY, categoryScore(destination, constraints), weights.category(),
                        categoryReason(destination, constraints)),
                FactorScore.of(ScoreFactor.MONTHS, monthsScore(destination, constraints), weights.months(),
                        constraints.bestMonths().isEmpty()
                                ? "No months specified (neutral score)"
                                : "Best months " + destination.bestMonths() + ", you prefer " + constraints.bestMonths()),
                FactorScore.of(ScoreFactor.DISTANCE, distanceScore(destination, constraints), weights.distance(),
                        constraints.distanceKm() == null
                                ? "No distance specified (neutral score)"
                                : "Distance " + destination.distanceKm() + " km, your limit "
                                + constraints.distanceKm() + " km"));

        double total = 0.0;
        for (final FactorScore factor : factors) {
            total += factor.contribution();
        }

        String rejection = budgetRejection(destination, constraints);
        if (rejection == null) {
            rejection = typeRejection(destination, constraints);
        }

        return new ScoreExplanation(destination, total, factors, rejection,
                rejection == null && total >= weights.relevanceThreshold());
    }

    // --- budget ---

    @Nullable String budgetRejection(final Destination destination, final QueryConstraints constraints) {
        final Integer min = constraints.budgetMin();
        final Integer max = constraints.budgetMax();

        if (min != null && max != null) {
            if (destination.budgetMin() > max || destination.budgetMax() < min) {
                return "Budget " + destination.formattedBudget() + " does not overlap your range ₹" + min + "-" + max;
            }
            return null;
        }
        if (min != null && destination.budgetMax() < min) {
            return "Budget " + destination.formattedBudget() + " is below your minimum of ₹" + min;
        }
        if (max != null && !constraints.budgetInferred() && destination.budgetMin() > max) {
            return "Budget " + destination.formattedBudget() + " starts above your ceiling of ₹" + max;
        }
        return null;
    }

    double budgetScore(final Destination destination, final QueryConstraints constraints) {
        final Integer min = constraints.budgetMin();
        final Integer max = constraints.budgetMax();

        if (min != null && max != null) {
            return budgetRejection(destination, constraints) == null ? 1.0 : 0.0;
        }
        if (max == null) {
            if (min != null) {
                return destination.budgetMax() >= min ? 1.0 : 0.0;
            }
            return NEUTRAL;
        }
        if (max <= 0) {
            return destination.budgetMin() <= 0 ? 1.0 : 0.0;
        }

        if (destination.budgetMin() <= max) {
            // Cheaper entry price earns up to the full bonus
            return 1.0 + weights.affordabilityBonus() * (1.0 - (double) destination.budgetMin() / max);
        }
        if (!constraints.budgetInferred()) {
            return 0.0;
        }

        final int deficit = destination.budgetMin() - max;
        if (deficit <= 500) {
            return 0.85;
        }
        if (deficit <= 1000) {
            return 0.75;
        }
        final double penalty = Math.min((double) deficit / destination.budgetMin(), 0.7);
        return Math.max(0.3, 1.0 - penalty);
    }

    private String budgetReason(final Destination destination, final QueryConstraints constraints) {
        final String rejection = budgetRejection(destination, constraints);
        if (rejection != null) {
            return rejection;
        }
        final Integer min = constraints.budgetMin();
        final Integer max = constraints.budgetMax();
        if (min != null && max != null) {
            return "Budget " + destination.formattedBudget() + " overlaps your range ₹" + min + "-" + max;
        }
        if (max != null) {
            final String ceiling = constraints.budgetInferred() ? "affordable ceiling" : "ceiling";
            if (destination.budgetMin() > max) {
                return "Budget " + destination.formattedBudget() + " is ₹" + (destination.budgetMin() - max)
                        + " above your " + ceiling + " of ₹" + max;
            }
            return "Budget " + destination.formattedBudget() + " fits your " + ceiling + " of ₹" + max;
        }
        if (min != null) {
            return "Budget " + destination.formattedBudget() + " reaches your minimum of ₹" + min;
        }
        return "No budget specified (neutral score)";
    }

    // --- mood, duration, months, distance ---

    static double moodScore(final Destination destination, final QueryConstraints constraints) {
        if (constraints.moods().isEmpty()) {
            return 1.0;
        }
        int matches = 0;
        for (final String mood : constraints.moods()) {
            if (destination.hasMood(mood)) {
                matches++;
            }
        }
        return (double) matches / constraints.moods().size();
    }

    private double durationWeight(final QueryConstraints constraints) {
        return constraints.hasDuration() ? weights.durationGiven() : weights.durationDefault();
    }

    static double durationScore(final Destination destination, final QueryConstraints constraints) {
        final Integer requested = constraints.durationDays();
        if (requested == null) {
            return NEUTRAL;
        }
        final int diff = Math.abs(destination.durationDays() - requested);
        if (diff == 0) {
            return 1.0;
        }
        if (diff <= 1) {
            return 0.9;
        }
        if (diff <= 2) {
            return 0.7;
        }
        return Math.max(0.4, 1.0 - 0.1 * diff);
    }

    static double monthsScore(final Destination destination, final QueryConstraints constraints) {
        if (constraints.bestMonths().isEmpty() || destination.bestMonths().isEmpty()) {
            return NEUTRAL;
        }
        int matches = 0;
        for (final String month : constraints.bestMonths()) {
            if (destination.isBestIn(month)) {
                matches++;
            }
        }
        return Math.min(1.0, (double) matches / constraints.bestMonths().size());
    }

    static double distanceScore(final Destination destination, final QueryConstraints constraints) {
        final Integer limit = constraints.distanceKm();
        if (limit == null) {
            return NEUTRAL;
        }
        final int distance = destination.distanceKm();
        if (limit <= 0) {
            return distance <= 0 ? 1.0 : 0.3;
        }
        if (distance <= limit) {
            return 1.0 - 0.3 * distance / limit;
        }
        final double excess = distance - limit;
        return Math.max(0.3, 1.0 - Math.min(excess / limit, 0.5));
    }

    // --- free text and category ---

    static double textMatchScore(final Destination destination, final List<String> terms) {
        if (terms.isEmpty()) {
            return NEUTRAL;
        }
        final String name = destination.name().toLowerCase(Locale.ROOT);
        final String moods = String.join(" ", destination.moods()).toLowerCase(Locale.ROOT);
        final String description = destination.description().toLowerCase(Locale.ROOT);

        int points = 0;
        for (final String term : terms) {
            final List<String> forms = surfaceForms(term);
            if (containsAny(name, forms)) {
                points += NAME_POINTS;
            } else if (containsAny(moods, forms)) {
                points += MOOD_POINTS;
            } else if (containsAny(description, forms)) {
                points += DESCRIPTION_POINTS;
            }
        }
        return Math.min((double) points / (NAME_POINTS * terms.size()), 1.0);
    }

    @Nullable String typeRejection(final Destination destination, final QueryConstraints constraints) {
        final List<String> typeTerms = new ArrayList<>();
        for (final String term : constraints.searchTerms()) {
            if (isTypeKeyword(term)) {
                typeTerms.add(term);
            }
        }
        if (typeTerms.isEmpty()) {
            return null;
        }
        final double typeScore = textMatchScore(destination, typeTerms);
        if (typeScore < weights.typeMatchFloor()) {
            return destination.name() + " does not match the requested type " + typeTerms;
        }
        return null;
    }

    static boolean isTypeKeyword(final String term) {
        for (final String form : surfaceForms(term)) {
            if (TYPE_KEYWORDS.contains(form)) {
                return true;
            }
        }
        return false;
    }

    static double categoryScore(final Destination destination, final QueryConstraints constraints) {
        final String placeName = constraints.placeName();
        if (placeName != null && placeName.equalsIgnoreCase(destination.name())) {
            return PLACE_MATCH_SCORE;
        }
        final String name = destination.name().toLowerCase(Locale.ROOT);
        for (final CategoryTier tier : CATEGORY_TIERS) {
            for (final String keyword : tier.keywords()) {
                if (name.contains(keyword)) {
                    return tier.score();
                }
            }
        }
        return GENERIC_CATEGORY_SCORE;
    }

    private static String categoryReason(final Destination destination, final QueryConstraints constraints) {
        final String placeName = constraints.placeName();
        if (placeName != null && placeName.equalsIgnoreCase(destination.name())) {
            return "Destination is the place you asked for";
        }
        return "Destination type from name '" + destination.name() + "'";
    }

    /**
     * The term itself plus its singular for simple English plurals ("beaches", "hills").
     */
    static List<String> surfaceForms(final String term) {
        final int length = term.length();
        if (length > 4 && (term.endsWith("ches") || term.endsWith("shes") || term.endsWith("xes")
                || term.endsWith("sses"))) {
            return List.of(term, term.substring(0, length - 2));
        }
        if (length > 3 && term.endsWith("s") && !term.endsWith("ss")) {
            return List.of(term, term.substring(0, length - 1));
        }
        return List.of(term);
    }

    private static boolean containsAny(final String text, final List<String> forms) {
        for (final String form : forms) {
            if (text.contains(form)) {
                return true;
            }
        }
        return false;
    }

    private record CategoryTier(double score, List<String> keywords) {
    }
}
