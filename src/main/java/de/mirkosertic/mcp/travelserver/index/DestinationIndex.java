package de.mirkosertic.mcp.travelserver.index;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import de.mirkosertic.mcp.travelserver.analysis.TokenStreams;
import de.mirkosertic.mcp.travelserver.catalog.Destination;
import org.apache.lucene.analysis.Analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One immutable generation of the destination index.
 * <p>
 * Holds the metadata of every destination, the term and mood reverse indexes and the per-term
 * document frequencies. The IDF memo belongs to the instance, so a new generation always starts
 * with an empty memo. Readers that keep a reference to an instance see a consistent catalog for
 * as long as they hold it.
 */
public final class DestinationIndex {

    private static final int MAX_IDF_CACHE_SIZE = 10_000;

    private final long generation;
    private final Map<Integer, Destination> destinationsById;
    private final Map<String, Set<Integer>> termIndex;
    private final Map<String, Set<Integer>> moodIndex;
    private final Map<String, Integer> documentFrequencies;
    private final int totalDestinations;
    private final Cache<String, Double> idfCache;

    private DestinationIndex(final long generation,
                             final Map<Integer, Destination> destinationsById,
                             final Map<String, Set<Integer>> termIndex,
                             final Map<String, Set<Integer>> moodIndex,
                             final Map<String, Integer> documentFrequencies) {
        this.generation = generation;
        this.destinationsById = Collections.unmodifiableMap(destinationsById);
        this.termIndex = freeze(termIndex);
        this.moodIndex = freeze(moodIndex);
        this.documentFrequencies = Collections.unmodifiableMap(documentFrequencies);
        this.totalDestinations = destinationsById.size();
        this.idfCache = Caffeine.newBuilder()
                .maximumSize(MAX_IDF_CACHE_SIZE)
                .build();
    }

    /**
     * An index without destinations, used before the first build.
     */
    static DestinationIndex empty() {
        return new DestinationIndex(0, new LinkedHashMap<>(), new HashMap<>(), new HashMap<>(), new HashMap<>());
    }

    /**
     * Build a new generation from the given destinations.
     * Every term of a destination's name and description is counted once per destination.
     */
    static DestinationIndex build(final List<Destination> destinations, final Analyzer analyzer,
                                  final long generation) {
        final Map<Integer, Destination> byId = new LinkedHashMap<>();
        final Map<String, Set<Integer>> terms = new HashMap<>();
        final Map<String, Set<Integer>> moods = new HashMap<>();
        final Map<String, Integer> frequencies = new HashMap<>();

        for (final Destination destination : destinations) {
            final int id = destination.id();
            byId.put(id, destination);

            for (final String mood : destination.moods()) {
                moods.computeIfAbsent(mood.toLowerCase(Locale.ROOT), k -> new LinkedHashSet<>()).add(id);
            }

            final Set<String> uniqueTerms = new LinkedHashSet<>(
                    TokenStreams.terms(analyzer, destination.name() + " " + destination.description()));
            for (final String term : uniqueTerms) {
                terms.computeIfAbsent(term, k -> new LinkedHashSet<>()).add(id);
                frequencies.merge(term, 1, Integer::sum);
            }
        }

        return new DestinationIndex(generation, byId, terms, moods, frequencies);
    }

    public long generation() {
        return generation;
    }

    public int totalDestinations() {
        return totalDestinations;
    }

    public Optional<Destination> getById(final int id) {
        return Optional.ofNullable(destinationsById.get(id));
    }

    /**
     * All destinations in catalog order.
     */
    public List<Destination> getAll() {
        return new ArrayList<>(destinationsById.values());
    }

    /**
     * Ids of destinations tagged with the mood, compared case-insensitively. Empty if none.
     */
    public Set<Integer> getByMood(final String mood) {
        return moodIndex.getOrDefault(mood.toLowerCase(Locale.ROOT), Set.of());
    }

    /**
     * Ids of destinations whose name or description contains the term. Empty if none.
     */
    public Set<Integer> getIdsForTerm(final String term) {
        return termIndex.getOrDefault(term.toLowerCase(Locale.ROOT), Set.of());
    }

    /**
     * Number of distinct indexed terms.
     */
    public int termCount() {
        return documentFrequencies.size();
    }

    public int documentFrequency(final String term) {
        return documentFrequencies.getOrDefault(term.toLowerCase(Locale.ROOT), 0);
    }

    /**
     * Inverse document frequency {@code ln(N / df(term))}.
     * Returns 0.0 for a term that is not indexed and for an empty catalog.
     */
    public double idf(final String term) {
        final String normalized = term.toLowerCase(Locale.ROOT);
        return idfCache.get(normalized, this::computeIdf);
    }

    public TermStatistics termStatistics(final String term) {
        final int df = documentFrequency(term);
        return new TermStatistics(term.toLowerCase(Locale.ROOT), df, totalDestinations, idf(term),
                TermStatistics.rarityOf(df, totalDestinations));
    }

    public Map<String, Set<Integer>> termIndex() {
        return termIndex;
    }

    public Map<String, Set<Integer>> moodIndex() {
        return moodIndex;
    }

    public Map<String, Integer> documentFrequencies() {
        return documentFrequencies;
    }

    /**
     * Number of entries currently held in the IDF memo.
     */
    long cachedIdfCount() {
        idfCache.cleanUp();
        return idfCache.estimatedSize();
    }

    private double computeIdf(final String term) {
        final int df = documentFrequencies.getOrDefault(term, 0);
        if (df == 0 || totalDestinations == 0) {
            return 0.0;
        }
        return Math.log((double) totalDestinations / df);
    }

    private static Map<String, Set<Integer>> freeze(final Map<String, Set<Integer>> source) {
        final Map<String, Set<Integer>> frozen = new HashMap<>(source.size());
        for (final Map.Entry<String, Set<Integer>> entry : source.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
        }
        return Collections.unmodifiableMap(frozen);
    }
}
