package de.mirkosertic.mcp.travelserver.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistent storage of the destination catalog as a JSON file.
 * <p>
 * All operations are synchronized, so concurrent add/remove requests are applied one after another.
 * Writes go to a temporary file first and replace the catalog in a single move.
 */
public class CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(CatalogStore.class);

    /**
     * Catalog shipped on the classpath, used to seed a missing catalog file.
     */
    public static final String BUNDLED_CATALOG = "travel_spots.json";

    private final Path catalogPath;
    private final ObjectMapper mapper;

    public CatalogStore(final Path catalogPath) {
        this.catalogPath = catalogPath;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Make sure the catalog file exists, copying the bundled catalog if needed.
     */
    public synchronized void init() throws IOException {
        if (Files.exists(catalogPath)) {
            return;
        }
        ensureParentDirectoryExists();
        final URL bundled = Resources.getResource(BUNDLED_CATALOG);
        try (final InputStream is = bundled.openStream()) {
            Files.copy(is, catalogPath);
        }
        logger.info("Created catalog file from bundled defaults: {}", catalogPath);
    }

    /**
     * Read the catalog document as a JSON tree without validating it.
     *
     * @throws CatalogFormatException if the file is not well-formed JSON
     * @throws IOException            if the file cannot be read
     */
    public synchronized JsonNode readDocument() throws IOException {
        try {
            return mapper.readTree(catalogPath.toFile());
        } catch (final JsonProcessingException e) {
            throw new CatalogFormatException("Malformed JSON in catalog file " + catalogPath
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Read and validate all destinations.
     */
    public synchronized List<Destination> readAll() throws IOException {
        return CatalogParser.parse(readDocument());
    }

    /**
     * Append a destination, assigning the next free id (highest id plus one).
     *
     * @return the stored destination including its id
     * @throws IllegalArgumentException if the draft is incomplete or inconsistent
     */
    public synchronized Destination add(final DestinationDraft draft) throws IOException {
        draft.validate();

        final List<Destination> destinations = new ArrayList<>(readAll());
        int maxId = 0;
        for (final Destination destination : destinations) {
            maxId = Math.max(maxId, destination.id());
        }
        final Destination created = draft.toDestination(maxId + 1);
        destinations.add(created);
        writeAll(destinations);

        logger.info("Added destination '{}' with id {}", created.name(), created.id());
        return created;
    }

    /**
     * Remove the destination with the given id.
     *
     * @return the removed destination, or empty if no destination had that id
     */
    public synchronized Optional<Destination> remove(final int id) throws IOException {
        final List<Destination> destinations = new ArrayList<>(readAll());
        Destination removed = null;
        for (int i = 0; i < destinations.size(); i++) {
            if (destinations.get(i).id() == id) {
                removed = destinations.remove(i);
                break;
            }
        }
        if (removed == null) {
            logger.debug("Destination {} not found in catalog", id);
            return Optional.empty();
        }

        writeAll(destinations);
        logger.info("Removed destination '{}' with id {}", removed.name(), id);
        return Optional.of(removed);
    }

    /**
     * Replace the catalog file content with the given destinations.
     */
    public synchronized void writeAll(final List<Destination> destinations) throws IOException {
        ensureParentDirectoryExists();
        final Path parent = catalogPath.toAbsolutePath().getParent();
        final Path tempFile = Files.createTempFile(parent, "catalog", ".json.tmp");
        try {
            mapper.writeValue(tempFile.toFile(), CatalogParser.toDocument(mapper, destinations));
            try {
                Files.move(tempFile, catalogPath, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(tempFile, catalogPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
        logger.debug("Wrote {} destinations to {}", destinations.size(), catalogPath);
    }

    public Path getCatalogPath() {
        return catalogPath;
    }

    private void ensureParentDirectoryExists() throws IOException {
        final Path parent = catalogPath.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            logger.debug("Created catalog directory: {}", parent);
        }
    }
}
