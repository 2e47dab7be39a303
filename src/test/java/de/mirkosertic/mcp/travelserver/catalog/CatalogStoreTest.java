package de.mirkosertic.mcp.travelserver.catalog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CatalogStore")
class CatalogStoreTest {

    @TempDir
    Path tempDir;

    private Path catalogFile;
    private CatalogStore store;

    @BeforeEach
    void setUp() {
        catalogFile = tempDir.resolve("catalog").resolve("travel_spots.json");
        store = new CatalogStore(catalogFile);
    }

    private static DestinationDraft draft(final String name) {
        return new DestinationDraft(name, List.of("nature"), 1000, 2000, 2, 150, 4.1,
                List.of("march"), "Green hills and waterfalls.");
    }

    @Test
    @DisplayName("init should seed a missing catalog from the bundled one")
    void initSeedsBundledCatalog() throws IOException {
        store.init();

        assertThat(catalogFile).exists();
        assertThat(store.readAll()).isNotEmpty()
                .extracting(Destination::name)
                .contains("Goa Beach", "Leh Ladakh Mountain");
    }

    @Test
    @DisplayName("init should leave an existing catalog untouched")
    void initKeepsExistingCatalog() throws IOException {
        Files.createDirectories(catalogFile.getParent());
        Files.writeString(catalogFile, "{\"travel_spots\": []}");

        store.init();

        assertThat(store.readAll()).isEmpty();
    }

    @Test
    @DisplayName("add should assign the highest id plus one and persist")
    void addAssignsNextId() throws IOException {
        store.init();
        final int maxId = store.readAll().stream().mapToInt(Destination::id).max().orElse(0);

        final Destination created = store.add(draft("Munnar Tea Hills"));

        assertThat(created.id()).isEqualTo(maxId + 1);
        assertThat(new CatalogStore(catalogFile).readAll())
                .extracting(Destination::name)
                .contains("Munnar Tea Hills");
    }

    @Test
    @DisplayName("add into an empty catalog should start at id 1")
    void addIntoEmptyCatalog() throws IOException {
        Files.createDirectories(catalogFile.getParent());
        Files.writeString(catalogFile, "{\"travel_spots\": []}");

        assertThat(store.add(draft("First")).id()).isEqualTo(1);
    }

    @Test
    @DisplayName("add should reject an invalid draft without touching the file")
    void addRejectsInvalidDraft() throws IOException {
        store.init();
        final String before = Files.readString(catalogFile);

        final DestinationDraft noName = new DestinationDraft(null, List.of("nature"), 1000, 2000, 2, 150, 4.1,
                null, "desc");

        assertThatThrownBy(() -> store.add(noName))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name");
        assertThat(Files.readString(catalogFile)).isEqualTo(before);
    }

    @Test
    @DisplayName("remove should delete the destination and report it")
    void removeDeletesDestination() throws IOException {
        store.init();
        final Destination created = store.add(draft("Temporary"));

        final Optional<Destination> removed = store.remove(created.id());

        assertThat(removed).contains(created);
        assertThat(store.readAll()).extracting(Destination::id).doesNotContain(created.id());
    }

    @Test
    @DisplayName("remove of an unknown id should return empty")
    void removeUnknownId() throws IOException {
        store.init();

        assertThat(store.remove(99_999)).isEmpty();
    }

    @Test
    @DisplayName("Malformed JSON should surface as CatalogFormatException")
    void malformedJsonIsFormatError() throws IOException {
        Files.createDirectories(catalogFile.getParent());
        Files.writeString(catalogFile, "{\"travel_spots\": [");

        assertThatThrownBy(() -> store.readDocument())
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("Malformed JSON");
    }

    @Test
    @DisplayName("writeAll should not leave temporary files behind")
    void writeAllLeavesNoTempFiles() throws IOException {
        store.init();

        store.writeAll(store.readAll());

        try (var files = Files.list(catalogFile.getParent())) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("travel_spots.json");
        }
    }
}
