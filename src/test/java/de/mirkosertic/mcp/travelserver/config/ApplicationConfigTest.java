package de.mirkosertic.mcp.travelserver.config;

import de.mirkosertic.mcp.travelserver.ranking.RankingWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApplicationConfig")
class ApplicationConfigTest {

    @Test
    @DisplayName("Empty document should give the built-in defaults")
    void defaults() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("");

        assertThat(config.getDefaultTopK()).isEqualTo(5);
        assertThat(config.getMaxTopK()).isEqualTo(50);
        assertThat(config.getAffordableCeiling()).isEqualTo(3500);
        assertThat(config.getRankingWeights()).isEqualTo(RankingWeights.defaults());
        assertThat(config.getCatalogPath())
                .isEqualTo(ApplicationConfig.getConfigDirectory().resolve("travel_spots.json").toString());
    }

    @Test
    @DisplayName("Ranking section should override individual values")
    void rankingOverrides() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                travel:
                  recommend:
                    default-top-k: 3
                  ranking:
                    weights:
                      budget: 0.5
                      distance: 0
                    relevance-threshold: 0.2
                    affordable-ceiling: 2000
                """);

        final RankingWeights weights = config.getRankingWeights();
        assertThat(config.getDefaultTopK()).isEqualTo(3);
        assertThat(weights.budget()).isEqualTo(0.5);
        assertThat(weights.distance()).isZero();
        assertThat(weights.mood()).isEqualTo(RankingWeights.DEFAULT_MOOD);
        assertThat(weights.relevanceThreshold()).isEqualTo(0.2);
        assertThat(config.getAffordableCeiling()).isEqualTo(2000);
        assertThat(weights.isNormalized()).isFalse();
    }

    @Test
    @DisplayName("Catalog path should resolve variables with defaults")
    void catalogPathVariables() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                travel:
                  catalog:
                    path: ${TRAVEL_TEST_UNSET_VARIABLE:/data/spots.json}
                """);

        assertThat(config.getCatalogPath()).isEqualTo("/data/spots.json");
    }

    @Test
    @DisplayName("Catalog path should resolve system properties")
    void catalogPathSystemProperty() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                travel:
                  catalog:
                    path: ${user.home}/spots.json
                """);

        assertThat(config.getCatalogPath())
                .isEqualTo(Paths.get(System.getProperty("user.home"), "spots.json").toString());
    }

    @Test
    @DisplayName("Invalid weight should fail when the weights are assembled")
    void invalidWeight() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                travel:
                  ranking:
                    type-match-floor: 2.0
                """);

        assertThatThrownBy(config::getRankingWeights)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("typeMatchFloor");
    }

    @Test
    @DisplayName("Bundled application.yaml should load")
    void bundledDefaults() {
        final ApplicationConfig config = ApplicationConfig.load();

        assertThat(config.getRankingWeights().totalWithDuration()).isGreaterThan(0.0);
        assertThat(config.getCatalogPath()).isNotBlank();
    }
}
