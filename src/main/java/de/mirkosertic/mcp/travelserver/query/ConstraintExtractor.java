package de.mirkosertic.mcp.travelserver.query;

import de.mirkosertic.mcp.travelserver.analysis.QueryTermAnalyzer;
import de.mirkosertic.mcp.travelserver.analysis.TokenStreams;
import org.apache.lucene.analysis.Analyzer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-text travel query into {@link QueryConstraints}.
 *
 * <p>Rules run in a fixed priority order: search terms, place name, budget, moods, months,
 * duration, distance. Within one field the patterns are tried in declaration order and the first
 * match wins. For the budget, range patterns beat single values and any number beats the
 * keyword default.</p>
 *
 * <p>The extractor holds no per-query state and is safe for concurrent use.</p>
 */
public class ConstraintExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintExtractor.class);

    public static final int DEFAULT_AFFORDABLE_CEILING = 3500;

    private static final String UNITS = "days?|d|nights?|weeks?|wks?|months?|km|kms|kilometers?|kilometres?";

    private static final String UNITS_AND_MONTHS = UNITS + "|" + monthAlternatives();

    // A number directly followed by one of these units is a duration or distance, never a budget
    private static final String NOT_A_UNIT = "(?!\\s*(?:" + UNITS + ")\\b)";

    // A bare number followed by a month name is a date
    private static final String NOT_A_UNIT_OR_DATE = "(?!\\s*(?:" + UNITS_AND_MONTHS + ")\\b)";

    // "3-5 days", "2 to 3 weeks", "between 10 and 12 dec": both numbers belong to the unit
    private static final Pattern UNIT_RANGE = Pattern.compile(
            "\\b(?:\\d+\\s*(?:-|to)|between\\s+\\d+\\s+and)\\s*\\d+\\s*(?:" + UNITS_AND_MONTHS + ")\\b");

    private static final String CURRENCY = "(?:(?:rupees|rs|inr)\\.?\\s*|₹\\s*)";

    private static final Pattern THOUSANDS_SEPARATOR = Pattern.compile("(?<=\\d),(?=\\d{3}\\b)");

    private static final List<Pattern> BUDGET_RANGE_RULES = List.of(
            Pattern.compile("\\bbetween\\s+" + CURRENCY + "?(\\d+)\\s+and\\s+" + CURRENCY + "?(\\d+)\\b" + NOT_A_UNIT_OR_DATE),
            Pattern.compile(CURRENCY + "?\\b(\\d+)\\s*(?:-|to)\\s*" + CURRENCY + "?(\\d+)\\b" + NOT_A_UNIT_OR_DATE)
    );

    private static final List<Pattern> BUDGET_CEILING_RULES = List.of(
            Pattern.compile("\\b(?:budget|rupees|rs|inr)(?:\\s+of)?[\\s:.]*(\\d+)\\b" + NOT_A_UNIT),
            Pattern.compile("\\b(\\d+)\\s*(?:rupees|rs|inr)\\b"),
            Pattern.compile("₹\\s*(\\d+)\\b"),
            Pattern.compile("\\b(?:upto|up to|under|below|max|maximum|less than)\\s+" + CURRENCY + "?(\\d+)\\b" + NOT_A_UNIT),
            Pattern.compile("\\b(\\d+)\\b" + NOT_A_UNIT_OR_DATE)
    );

    private static final Pattern BUDGET_KEYWORDS = Pattern.compile("\\b(?:cheap\\w*|afford\\w*|budget|friendly)\\b");

    private static final List<Pattern> DURATION_RULES = List.of(
            Pattern.compile("\\b(?:for|duration)[\\s:]*(\\d+)\\s*days?\\b"),
            Pattern.compile("\\b(\\d+)\\s*(?:days?|d)\\b"),
            Pattern.compile("\\b(\\d+)\\s*nights?\\b")
    );

    private static final Pattern WEEKS = Pattern.compile("\\b(\\d+)\\s*(?:weeks?|wks?)\\b");

    private static final List<Pattern> DISTANCE_RULES = List.of(
            Pattern.compile("\\b(?:within|upto|up to|max|maximum)[\\s:]*(\\d+)\\s*(?:km|kms|kilometers?|kilometres?)\\b"),
            Pattern.compile("\\b(\\d+)\\s*(?:km|kms|kilometers?|kilometres?)\\b")
    );

    private static final Map<String, String> PLACE_ALIASES = new LinkedHashMap<>();
    private static final Map<String, List<String>> MOOD_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, Set<Month>> SEASONS = new LinkedHashMap<>();

    static {
        PLACE_ALIASES.put("manali", "Manali Hill Station");
        PLACE_ALIASES.put("goa", "Goa Beach");
        PLACE_ALIASES.put("kerala", "Kerala Backwaters");
        PLACE_ALIASES.put("kochi", "Kerala Backwaters");
        PLACE_ALIASES.put("backwaters", "Kerala Backwaters");
        PLACE_ALIASES.put("leh", "Leh Ladakh Mountain");
        PLACE_ALIASES.put("ladakh", "Leh Ladakh Mountain");
        PLACE_ALIASES.put("ooty", "Ooty Hill Station");
        PLACE_ALIASES.put("shimla", "Shimla Snow Mountain");
        PLACE_ALIASES.put("jaipur", "Jaipur City Tour");
        PLACE_ALIASES.put("varanasi", "Varanasi Spiritual");
        PLACE_ALIASES.put("mumbai", "Mumbai Night Life");
        PLACE_ALIASES.put("rishikesh", "Rishikesh Yoga");

        MOOD_KEYWORDS.put("adventure", List.of("adventure", "trekking", "hiking", "extreme", "thrill", "trek", "climb"));
        MOOD_KEYWORDS.put("nature", List.of("nature", "wildlife", "forest", "scenic", "landscape", "hill", "mountain", "snow"));
        MOOD_KEYWORDS.put("relaxing", List.of("relax", "chill", "peaceful", "calm", "quiet", "rest", "beach", "backwater"));
        MOOD_KEYWORDS.put("party", List.of("party", "nightlife", "disco", "club", "fun", "dance", "night"));
        MOOD_KEYWORDS.put("cultural", List.of("culture", "cultural", "heritage", "art", "museum", "city", "tour"));
        MOOD_KEYWORDS.put("history", List.of("history", "historical", "ancient", "monument", "temple"));
        MOOD_KEYWORDS.put("spiritual", List.of("spiritual", "meditation", "yoga", "zen", "peace"));
        MOOD_KEYWORDS.put("romantic", List.of("romantic", "couple", "honeymoon", "love"));

        SEASONS.put("winter", EnumSet.of(Month.DECEMBER, Month.JANUARY, Month.FEBRUARY));
        SEASONS.put("summer", EnumSet.of(Month.MARCH, Month.APRIL, Month.MAY, Month.JUNE));
        SEASONS.put("monsoon", EnumSet.of(Month.JUNE, Month.JULY, Month.AUGUST, Month.SEPTEMBER));
        SEASONS.put("autumn", EnumSet.of(Month.SEPTEMBER, Month.OCTOBER, Month.NOVEMBER));
    }

    private static final Map<Month, Pattern> MONTH_PATTERNS = monthPatterns();
    private static final Map<String, Pattern> PLACE_PATTERNS = wordStartPatterns(PLACE_ALIASES.keySet());
    private static final Map<String, Pattern> SEASON_PATTERNS = wordStartPatterns(SEASONS.keySet());

    private final int affordableCeiling;
    private final Analyzer termAnalyzer;

    public ConstraintExtractor() {
        this(DEFAULT_AFFORDABLE_CEILING);
    }

    public ConstraintExtractor(final int affordableCeiling) {
        this(affordableCeiling, new QueryTermAnalyzer());
    }

    public ConstraintExtractor(final int affordableCeiling, final Analyzer termAnalyzer) {
        if (affordableCeiling < 1) {
            throw new IllegalArgumentException("Affordable ceiling must be positive, got " + affordableCeiling);
        }
        this.affordableCeiling = affordableCeiling;
        this.termAnalyzer = termAnalyzer;
    }

    /**
     * Parse the query. Fields the query says nothing about stay unconstrained.
     *
     * @throws IllegalArgumentException if the query is null
     */
    public QueryConstraints extract(final @Nullable String query) {
        if (query == null) {
            throw new IllegalArgumentException("Query must not be null");
        }

        final String text = THOUSANDS_SEPARATOR.matcher(query.toLowerCase(Locale.ROOT).trim()).replaceAll("");
        final Builder builder = new Builder();

        builder.searchTerms = extractSearchTerms(text);
        builder.placeName = extractPlaceName(text);
        extractBudget(UNIT_RANGE.matcher(text).replaceAll(" "), builder);
        builder.moods = extractMoods(text);
        builder.bestMonths = extractMonths(text);
        builder.durationDays = extractDuration(text);
        builder.distanceKm = firstNumber(DISTANCE_RULES, text);

        final QueryConstraints constraints = builder.build();
        logger.debug("Extracted constraints from '{}': {}", query, constraints);
        return constraints;
    }

    public int getAffordableCeiling() {
        return affordableCeiling;
    }

    private List<String> extractSearchTerms(final String text) {
        return new ArrayList<>(new LinkedHashSet<>(TokenStreams.terms(termAnalyzer, text)));
    }

    private static @Nullable String extractPlaceName(final String text) {
        for (final Map.Entry<String, Pattern> entry : PLACE_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return PLACE_ALIASES.get(entry.getKey());
            }
        }
        return null;
    }

    private void extractBudget(final String text, final Builder builder) {
        for (final Pattern rule : BUDGET_RANGE_RULES) {
            final Matcher matcher = rule.matcher(text);
            if (matcher.find()) {
                final Integer first = parseNumber(matcher.group(1));
                final Integer second = parseNumber(matcher.group(2));
                if (first == null || second == null) {
                    continue;
                }
                builder.budgetMin = Math.min(first, second);
                builder.budgetMax = Math.max(first, second);
                return;
            }
        }

        final Integer ceiling = firstNumber(BUDGET_CEILING_RULES, text);
        if (ceiling != null) {
            builder.budgetMax = ceiling;
            return;
        }

        if (BUDGET_KEYWORDS.matcher(text).find()) {
            builder.budgetMax = affordableCeiling;
            builder.budgetInferred = true;
        }
    }

    private static Set<String> extractMoods(final String text) {
        final Set<String> moods = new LinkedHashSet<>();
        for (final Map.Entry<String, List<String>> entry : MOOD_KEYWORDS.entrySet()) {
            for (final String keyword : entry.getValue()) {
                if (text.contains(keyword)) {
                    moods.add(entry.getKey());
                    break;
                }
            }
        }
        return moods;
    }

    private static Set<String> extractMonths(final String text) {
        final EnumSet<Month> months = EnumSet.noneOf(Month.class);
        for (final Map.Entry<Month, Pattern> entry : MONTH_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                months.add(entry.getKey());
            }
        }
        for (final Map.Entry<String, Pattern> entry : SEASON_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                months.addAll(SEASONS.get(entry.getKey()));
            }
        }

        // EnumSet iterates in calendar order
        final Set<String> names = new LinkedHashSet<>();
        for (final Month month : months) {
            names.add(monthName(month));
        }
        return names;
    }

    private static @Nullable Integer extractDuration(final String text) {
        final Integer days = firstNumber(DURATION_RULES, text);
        if (days != null) {
            return days;
        }
        final Integer weeks = firstNumber(List.of(WEEKS), text);
        if (weeks == null) {
            return null;
        }
        if (weeks > Integer.MAX_VALUE / 7) {
            logger.warn("Ignoring out of range duration of {} weeks in query", weeks);
            return null;
        }
        return weeks * 7;
    }

    private static @Nullable Integer firstNumber(final List<Pattern> rules, final String text) {
        for (final Pattern rule : rules) {
            final Matcher matcher = rule.matcher(text);
            if (matcher.find()) {
                final Integer number = parseNumber(matcher.group(1));
                if (number != null) {
                    return number;
                }
            }
        }
        return null;
    }

    private static @Nullable Integer parseNumber(final String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring out of range number '{}' in query", digits);
            return null;
        }
    }

    static String monthName(final Month month) {
        return month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
    }

    private static String monthAlternatives() {
        final List<String> names = new ArrayList<>();
        for (final Month month : Month.values()) {
            final String full = monthName(month);
            names.add(full);
            names.add(full.substring(0, 3));
        }
        names.add("sept");
        return String.join("|", names);
    }

    private static Map<Month, Pattern> monthPatterns() {
        final Map<Month, Pattern> patterns = new LinkedHashMap<>();
        for (final Month month : Month.values()) {
            final String full = monthName(month);
            final String abbreviation = full.substring(0, 3);
            final String alternatives = month == Month.SEPTEMBER
                    ? full + "|sept|" + abbreviation
                    : full + "|" + abbreviation;
            patterns.put(month, Pattern.compile("\\b(?:" + alternatives + ")\\b"));
        }
        return patterns;
    }

    private static Map<String, Pattern> wordStartPatterns(final Set<String> words) {
        final Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (final String word : words) {
            patterns.put(word, Pattern.compile("\\b" + Pattern.quote(word)));
        }
        return patterns;
    }

    private static final class Builder {
        private @Nullable Integer budgetMin;
        private @Nullable Integer budgetMax;
        private boolean budgetInferred;
        private Set<String> moods = Set.of();
        private @Nullable Integer durationDays;
        private @Nullable Integer distanceKm;
        private @Nullable String placeName;
        private Set<String> bestMonths = Set.of();
        private List<String> searchTerms = List.of();

        private QueryConstraints build() {
            return new QueryConstraints(budgetMin, budgetMax, budgetInferred, moods, durationDays, distanceKm,
                    placeName, bestMonths, searchTerms);
        }
    }
}
