package de.mirkosertic.mcp.travelserver.index;

import de.mirkosertic.mcp.travelserver.TestDestinations;
import de.mirkosertic.mcp.travelserver.catalog.CatalogFormatException;
import de.mirkosertic.mcp.travelserver.catalog.Destination;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static de.mirkosertic.mcp.travelserver.TestDestinations.destination;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DestinationIndexer")
class DestinationIndexerTest {

    private DestinationIndexer indexer;

    @BeforeEach
    void setUp() {
        indexer = new DestinationIndexer();
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("build before load should fail")
        void buildBeforeLoadFails() {
            assertThatThrownBy(() -> indexer.build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("load()");
        }

        @Test
        @DisplayName("Queries before the first build should see an empty catalog")
        void emptyBeforeBuild() {
            indexer.load(TestDestinations.testCatalog());

            assertThat(indexer.isLoaded()).isTrue();
            assertThat(indexer.totalDestinations()).isZero();
            assertThat(indexer.idf("beach")).isZero();
            assertThat(indexer.getAll()).isEmpty();
        }

        @Test
        @DisplayName("Duplicate ids in a list should be rejected")
        void duplicateIdsRejected() {
            final List<Destination> destinations = List.of(
                    destination(1, "A", List.of("nature"), 100, 200, 1, 10, 4.0, "first"),
                    destination(1, "B", List.of("nature"), 100, 200, 1, 10, 4.0, "second"));

            assertThatThrownBy(() -> indexer.load(destinations))
                    .isInstanceOf(CatalogFormatException.class)
                    .hasMessageContaining("Duplicate destination id 1");
        }

        @Test
        @DisplayName("Loading a file with malformed JSON should raise a format error")
        void malformedFile(@TempDir final Path tempDir) throws IOException {
            final Path file = tempDir.resolve("broken.json");
            Files.writeString(file, "{ \"travel_spots\": [ { ");

            assertThatThrownBy(() -> indexer.load(file))
                    .isInstanceOf(CatalogFormatException.class)
                    .hasMessageContaining("not valid JSON");
        }

        @Test
        @DisplayName("Loading a file with the wrong shape should raise a format error")
        void wrongShapeFile(@TempDir final Path tempDir) throws IOException {
            final Path file = tempDir.resolve("shape.json");
            Files.writeString(file, "{ \"spots\": [] }");

            assertThatThrownBy(() -> indexer.load(file))
                    .isInstanceOf(CatalogFormatException.class)
                    .hasMessageContaining("travel_spots");
        }

        @Test
        @DisplayName("Each build should publish a new generation")
        void buildIncrementsGeneration() {
            indexer.load(TestDestinations.testCatalog());

            final long first = indexer.build().generation();
            final long second = indexer.build().generation();

            assertThat(second).isGreaterThan(first);
            assertThat(indexer.generation()).isEqualTo(second);
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @BeforeEach
        void build() {
            indexer.load(TestDestinations.testCatalog());
            indexer.build();
        }

        @Test
        @DisplayName("getById should return the destination or empty")
        void getById() {
            assertThat(indexer.getById(3)).hasValueSatisfying(d -> assertThat(d.name()).isEqualTo("Leh Ladakh Mountain"));
            assertThat(indexer.getById(999)).isEmpty();
        }

        @Test
        @DisplayName("getByMood should ignore case")
        void getByMoodIgnoresCase() {
            assertThat(indexer.getByMood("Adventure")).containsExactlyInAnyOrder(2, 3);
            assertThat(indexer.getByMood("HISTORY")).containsExactlyInAnyOrder(4, 5);
            assertThat(indexer.getByMood("romantic")).isEmpty();
        }

        @Test
        @DisplayName("getAll should keep catalog order")
        void getAllKeepsOrder() {
            assertThat(indexer.getAll()).extracting(Destination::id).containsExactly(1, 2, 3, 4, 5);
        }

        @Test
        @DisplayName("A term repeated in one destination should count once")
        void documentFrequencyCountsDestinations() {
            // "beach" appears twice in Goa's name and description
            assertThat(indexer.documentFrequency("beach")).isEqualTo(1);
            assertThat(indexer.getIdsForTerm("beach")).containsExactly(1);
            assertThat(indexer.documentFrequency("and")).isEqualTo(5);
        }

        @Test
        @DisplayName("idf should be ln(N/df)")
        void idfFormula() {
            assertThat(indexer.idf("beach")).isCloseTo(Math.log(5.0), within(1e-9));
            assertThat(indexer.idf("Mountain")).isCloseTo(Math.log(5.0), within(1e-9));
        }

        @Test
        @DisplayName("A term in every destination should have idf 0")
        void ubiquitousTermHasZeroIdf() {
            assertThat(indexer.idf("and")).isZero();
        }

        @Test
        @DisplayName("Unknown terms should have idf 0")
        void unknownTermHasZeroIdf() {
            assertThat(indexer.idf("volcano")).isZero();
            assertThat(indexer.documentFrequency("volcano")).isZero();
        }

        @Test
        @DisplayName("Term statistics should classify rarity")
        void termStatistics() {
            final TermStatistics and = indexer.termStatistics("and");
            final TermStatistics beach = indexer.termStatistics("beach");
            final TermStatistics volcano = indexer.termStatistics("volcano");

            assertThat(and.rarity()).isEqualTo("very common");
            assertThat(beach.rarity()).isEqualTo("uncommon");
            assertThat(beach.totalDestinations()).isEqualTo(5);
            assertThat(volcano.rarity()).isEqualTo("absent");
        }

        @Test
        @DisplayName("Index views should be read-only")
        void viewsAreReadOnly() {
            final DestinationIndex index = indexer.snapshot();

            assertThatThrownBy(() -> index.termIndex().put("x", Set.of()))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> index.getIdsForTerm("beach").add(99))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Rebuilds")
    class Rebuilds {

        @Test
        @DisplayName("Building the same catalog twice should give identical indexes")
        void rebuildIsIdempotent() {
            indexer.load(TestDestinations.testCatalog());
            final DestinationIndex first = indexer.build();
            final DestinationIndex second = indexer.build();

            assertThat(second.termIndex()).isEqualTo(first.termIndex());
            assertThat(second.moodIndex()).isEqualTo(first.moodIndex());
            assertThat(second.documentFrequencies()).isEqualTo(first.documentFrequencies());
        }

        @Test
        @DisplayName("A snapshot taken before a rebuild should keep its catalog")
        void snapshotIsIsolated() {
            indexer.load(TestDestinations.testCatalog());
            indexer.build();
            final DestinationIndex before = indexer.snapshot();

            indexer.load(List.of(destination(1, "Only Beach", List.of("relaxing"), 100, 200, 1, 10, 4.0,
                    "A single beach.")));
            indexer.build();

            assertThat(before.totalDestinations()).isEqualTo(5);
            assertThat(before.idf("beach")).isCloseTo(Math.log(5.0), within(1e-9));
            assertThat(indexer.totalDestinations()).isEqualTo(1);
            assertThat(indexer.idf("beach")).isZero();
        }

        @Test
        @DisplayName("A new generation should start with an empty IDF memo")
        void idfMemoIsPerGeneration() {
            indexer.load(TestDestinations.testCatalog());
            final DestinationIndex first = indexer.build();
            first.idf("beach");
            first.idf("mountain");
            assertThat(first.cachedIdfCount()).isEqualTo(2);

            final DestinationIndex second = indexer.build();

            assertThat(second.cachedIdfCount()).isZero();
        }

        @Test
        @DisplayName("An empty catalog should build and answer every idf with 0")
        void emptyCatalog() {
            indexer.load(List.of());

            final DestinationIndex index = indexer.build();

            assertThat(index.totalDestinations()).isZero();
            assertThat(index.idf("beach")).isZero();
            assertThat(index.termCount()).isZero();
        }
    }
}
