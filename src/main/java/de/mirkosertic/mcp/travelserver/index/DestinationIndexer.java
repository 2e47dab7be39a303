package de.mirkosertic.mcp.travelserver.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.travelserver.analysis.CatalogTextAnalyzer;
import de.mirkosertic.mcp.travelserver.catalog.CatalogFormatException;
import de.mirkosertic.mcp.travelserver.catalog.CatalogParser;
import de.mirkosertic.mcp.travelserver.catalog.Destination;
import org.apache.lucene.analysis.Analyzer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the destination catalog and publishes searchable {@link DestinationIndex} generations.
 * <p>
 * {@link #load} and {@link #build} are serialized. A build creates a complete new generation and
 * swaps it in atomically, so concurrent readers always see either the old or the new catalog.
 */
public class DestinationIndexer {

    private static final Logger logger = LoggerFactory.getLogger(DestinationIndexer.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Analyzer analyzer;
    private final AtomicReference<DestinationIndex> current = new AtomicReference<>(DestinationIndex.empty());
    private final AtomicLong generations = new AtomicLong();

    private volatile @Nullable List<Destination> loaded;

    public DestinationIndexer() {
        this(new CatalogTextAnalyzer());
    }

    public DestinationIndexer(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Load the catalog from a parsed JSON document with a {@code travel_spots} array.
     *
     * @throws CatalogFormatException if the document does not describe a valid catalog
     */
    public void load(final JsonNode document) {
        load(CatalogParser.parse(document));
    }

    /**
     * Load the catalog from a JSON file.
     *
     * @throws IOException if the file cannot be read
     * @throws CatalogFormatException if the file is not valid JSON or not a valid catalog
     */
    public void load(final Path catalogFile) throws IOException {
        final byte[] content = Files.readAllBytes(catalogFile);
        final JsonNode document;
        try {
            document = objectMapper.readTree(content);
        } catch (final JsonProcessingException e) {
            throw new CatalogFormatException("Catalog file " + catalogFile + " is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }
        load(document);
    }

    /**
     * Replace the loaded destination list. The searchable index changes only on the next {@link #build()}.
     *
     * @throws CatalogFormatException if two destinations share an id
     */
    public synchronized void load(final List<Destination> destinations) {
        final Set<Integer> seen = new HashSet<>();
        for (final Destination destination : destinations) {
            if (!seen.add(destination.id())) {
                throw new CatalogFormatException("Duplicate destination id " + destination.id());
            }
        }
        loaded = List.copyOf(destinations);
        logger.info("Loaded {} destinations", destinations.size());
    }

    /**
     * Build a new index generation from the loaded destinations and publish it.
     *
     * @throws IllegalStateException if nothing has been loaded yet
     */
    public synchronized DestinationIndex build() {
        final List<Destination> destinations = loaded;
        if (destinations == null) {
            throw new IllegalStateException("No catalog loaded, call load() before build()");
        }

        final long startTime = System.nanoTime();
        final DestinationIndex index = DestinationIndex.build(destinations, analyzer, generations.incrementAndGet());
        current.set(index);

        logger.info("Built index generation {} with {} destinations and {} terms in {} ms",
                index.generation(), index.totalDestinations(), index.termCount(),
                (System.nanoTime() - startTime) / 1_000_000);
        return index;
    }

    /**
     * The currently published generation. Callers that need a consistent view across several
     * lookups should hold on to the returned instance.
     */
    public DestinationIndex snapshot() {
        return current.get();
    }

    public boolean isLoaded() {
        return loaded != null;
    }

    public Optional<Destination> getById(final int id) {
        return snapshot().getById(id);
    }

    public Set<Integer> getByMood(final String mood) {
        return snapshot().getByMood(mood);
    }

    public double idf(final String term) {
        return snapshot().idf(term);
    }

    public Set<Integer> getIdsForTerm(final String term) {
        return snapshot().getIdsForTerm(term);
    }

    public int documentFrequency(final String term) {
        return snapshot().documentFrequency(term);
    }

    public int termCount() {
        return snapshot().termCount();
    }

    public List<Destination> getAll() {
        return snapshot().getAll();
    }

    public int totalDestinations() {
        return snapshot().totalDestinations();
    }

    public long generation() {
        return snapshot().generation();
    }

    public TermStatistics termStatistics(final String term) {
        return snapshot().termStatistics(term);
    }
}
