package de.mirkosertic.mcp.travelserver;

import de.mirkosertic.mcp.travelserver.catalog.CatalogStore;
import de.mirkosertic.mcp.travelserver.catalog.Destination;
import de.mirkosertic.mcp.travelserver.catalog.DestinationDraft;
import de.mirkosertic.mcp.travelserver.index.DestinationIndex;
import de.mirkosertic.mcp.travelserver.index.DestinationIndexer;
import de.mirkosertic.mcp.travelserver.query.ConstraintExtractor;
import de.mirkosertic.mcp.travelserver.query.QueryConstraints;
import de.mirkosertic.mcp.travelserver.ranking.DestinationRanker;
import de.mirkosertic.mcp.travelserver.ranking.RankedDestination;
import de.mirkosertic.mcp.travelserver.ranking.ScoreExplanation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs the recommendation pipeline and keeps the index in step with the catalog file.
 * <p>
 * Every catalog mutation is persisted first and then followed by a full load and rebuild, so the
 * next query after {@link #addDestination} or {@link #removeDestination} returns sees the change.
 */
public class TravelRecommendationService {

    private static final Logger logger = LoggerFactory.getLogger(TravelRecommendationService.class);

    private final CatalogStore catalogStore;
    private final DestinationIndexer indexer;
    private final ConstraintExtractor extractor;
    private final DestinationRanker ranker;

    public TravelRecommendationService(final CatalogStore catalogStore,
                                       final DestinationIndexer indexer,
                                       final ConstraintExtractor extractor,
                                       final DestinationRanker ranker) {
        this.catalogStore = catalogStore;
        this.indexer = indexer;
        this.extractor = extractor;
        this.ranker = ranker;
    }

    /**
     * Create the catalog file if needed and build the first index generation.
     */
    public void init() throws IOException {
        catalogStore.init();
        reload();
    }

    /**
     * Re-read the catalog file and rebuild the index.
     *
     * @return number of destinations now being served
     */
    public synchronized int reload() throws IOException {
        indexer.load(catalogStore.readDocument());
        return indexer.build().totalDestinations();
    }

    public RecommendationResult recommend(final String query, final int topK) {
        return recommend(query, topK, false);
    }

    public RecommendationResult recommendWithExplanation(final String query, final int topK) {
        return recommend(query, topK, true);
    }

    private RecommendationResult recommend(final String query, final int topK, final boolean explain) {
        final long startTime = System.nanoTime();

        final QueryConstraints constraints = extractor.extract(query);
        final List<RankedDestination> ranked = ranker.rank(constraints, topK, explain);

        final List<RecommendationResult.Entry> entries = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            final RankedDestination result = ranked.get(i);
            final ScoreExplanation explanation = result.explanation();
            entries.add(RecommendationResult.Entry.of(i + 1, result.destination(), result.score(),
                    explanation != null ? explanation.factors() : null));
        }

        logger.info("Query '{}' returned {} results in {} ms", query, entries.size(),
                (System.nanoTime() - startTime) / 1_000_000);
        return new RecommendationResult(query, constraints, entries, entries.size());
    }

    /**
     * Explain how one destination scores for a query.
     *
     * @return empty if the destination does not exist
     */
    public Optional<ScoreExplanation> explain(final String query, final int destinationId) {
        return ranker.explainScore(destinationId, extractor.extract(query));
    }

    public List<Destination> listDestinations() {
        return indexer.getAll();
    }

    /**
     * Persist a new destination and rebuild.
     *
     * @throws IllegalArgumentException if the draft is incomplete or inconsistent
     */
    public synchronized Destination addDestination(final DestinationDraft draft) throws IOException {
        final Destination created = catalogStore.add(draft);
        reload();
        return created;
    }

    /**
     * Remove a destination and rebuild.
     *
     * @return the removed destination, or empty if the id is unknown (nothing is rebuilt then)
     */
    public synchronized Optional<Destination> removeDestination(final int destinationId) throws IOException {
        final Optional<Destination> removed = catalogStore.remove(destinationId);
        if (removed.isPresent()) {
            reload();
        }
        return removed;
    }

    public CatalogStats catalogStats() {
        final DestinationIndex snapshot = indexer.snapshot();
        final Map<String, Integer> moodCounts = new TreeMap<>();
        for (final Map.Entry<String, Set<Integer>> entry : snapshot.moodIndex().entrySet()) {
            moodCounts.put(entry.getKey(), entry.getValue().size());
        }
        return new CatalogStats(snapshot.totalDestinations(), snapshot.termCount(), moodCounts,
                snapshot.generation(), catalogStore.getCatalogPath().toString());
    }

    public DestinationIndexer getIndexer() {
        return indexer;
    }
}
