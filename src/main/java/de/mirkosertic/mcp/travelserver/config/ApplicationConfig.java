package de.mirkosertic.mcp.travelserver.config;

import de.mirkosertic.mcp.travelserver.query.ConstraintExtractor;
import de.mirkosertic.mcp.travelserver.ranking.RankingWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the travel recommendation server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.travelserver/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CATALOG_PATH = "TRAVEL_CATALOG_PATH";
    private static final String PROP_CATALOG_PATH = "travel.catalog.path";
    private static final String PROP_PROFILE = "profile";
    private static final String CONFIG_DIR = ".travelserver";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";
    private static final String DEFAULT_CATALOG_FILE = "travel_spots.json";

    // Catalog settings
    private String catalogPath;

    // Recommendation settings
    private int defaultTopK = 5;
    private int maxTopK = 50;

    // Ranking settings
    private double budgetWeight = RankingWeights.DEFAULT_BUDGET;
    private double moodWeight = RankingWeights.DEFAULT_MOOD;
    private double durationGivenWeight = RankingWeights.DEFAULT_DURATION_GIVEN;
    private double durationDefaultWeight = RankingWeights.DEFAULT_DURATION_DEFAULT;
    private double textMatchWeight = RankingWeights.DEFAULT_TEXT_MATCH;
    private double categoryWeight = RankingWeights.DEFAULT_CATEGORY;
    private double monthsWeight = RankingWeights.DEFAULT_MONTHS;
    private double distanceWeight = RankingWeights.DEFAULT_DISTANCE;
    private double relevanceThreshold = RankingWeights.DEFAULT_RELEVANCE_THRESHOLD;
    private double affordabilityBonus = RankingWeights.DEFAULT_AFFORDABILITY_BONUS;
    private double typeMatchFloor = RankingWeights.DEFAULT_TYPE_MATCH_FLOOR;
    private int affordableCeiling = ConstraintExtractor.DEFAULT_AFFORDABLE_CEILING;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: catalogPath={}, defaultTopK={}, deployedMode={}",
                config.catalogPath, config.defaultTopK, config.deployedMode);

        return config;
    }

    /**
     * Build a configuration from a single YAML document, without user file or environment.
     */
    static ApplicationConfig fromYaml(final String yamlContent) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yaml = new Yaml().load(yamlContent);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        config.applyDefaults();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to travel section
        final Map<String, Object> travelConfig = (Map<String, Object>) config.get("travel");
        if (travelConfig == null) {
            return;
        }

        final Map<String, Object> catalogConfig = (Map<String, Object>) travelConfig.get("catalog");
        if (catalogConfig != null) {
            final Object path = catalogConfig.get("path");
            if (path != null) {
                this.catalogPath = resolveVariables(path.toString());
            }
        }

        final Map<String, Object> recommendConfig = (Map<String, Object>) travelConfig.get("recommend");
        if (recommendConfig != null) {
            if (recommendConfig.containsKey("default-top-k")) {
                this.defaultTopK = ((Number) recommendConfig.get("default-top-k")).intValue();
            }
            if (recommendConfig.containsKey("max-top-k")) {
                this.maxTopK = ((Number) recommendConfig.get("max-top-k")).intValue();
            }
        }

        final Map<String, Object> rankingConfig = (Map<String, Object>) travelConfig.get("ranking");
        if (rankingConfig != null) {
            applyRankingConfig(rankingConfig);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyRankingConfig(final Map<String, Object> rankingConfig) {
        final Map<String, Object> weights = (Map<String, Object>) rankingConfig.get("weights");
        if (weights != null) {
            this.budgetWeight = doubleValue(weights, "budget", budgetWeight);
            this.moodWeight = doubleValue(weights, "mood", moodWeight);
            this.durationGivenWeight = doubleValue(weights, "duration-given", durationGivenWeight);
            this.durationDefaultWeight = doubleValue(weights, "duration-default", durationDefaultWeight);
            this.textMatchWeight = doubleValue(weights, "text-match", textMatchWeight);
            this.categoryWeight = doubleValue(weights, "category", categoryWeight);
            this.monthsWeight = doubleValue(weights, "months", monthsWeight);
            this.distanceWeight = doubleValue(weights, "distance", distanceWeight);
        }
        this.relevanceThreshold = doubleValue(rankingConfig, "relevance-threshold", relevanceThreshold);
        this.affordabilityBonus = doubleValue(rankingConfig, "affordability-bonus", affordabilityBonus);
        this.typeMatchFloor = doubleValue(rankingConfig, "type-match-floor", typeMatchFloor);
        if (rankingConfig.containsKey("affordable-ceiling")) {
            this.affordableCeiling = ((Number) rankingConfig.get("affordable-ceiling")).intValue();
        }
    }

    private static double doubleValue(final Map<String, Object> section, final String key, final double fallback) {
        final Object value = section.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : fallback;
    }

    private void applyEnvironmentOverrides() {
        // Catalog path from environment
        final String envCatalogPath = System.getenv(ENV_CATALOG_PATH);
        if (envCatalogPath != null && !envCatalogPath.trim().isEmpty()) {
            this.catalogPath = envCatalogPath.trim();
            logger.info("Catalog path from environment: {}", this.catalogPath);
        }

        // System property for catalog path
        final String propCatalogPath = System.getProperty(PROP_CATALOG_PATH);
        if (propCatalogPath != null && !propCatalogPath.isEmpty()) {
            this.catalogPath = propCatalogPath;
        }

        applyDefaults();
    }

    private void applyDefaults() {
        if (this.catalogPath == null || this.catalogPath.isEmpty()) {
            this.catalogPath = getConfigDirectory().resolve(DEFAULT_CATALOG_FILE).toString();
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Ranking parameters assembled from the individual settings.
     *
     * @throws IllegalArgumentException if a configured value is out of range
     */
    public RankingWeights getRankingWeights() {
        return new RankingWeights(budgetWeight, moodWeight, durationGivenWeight, durationDefaultWeight,
                textMatchWeight, categoryWeight, monthsWeight, distanceWeight,
                relevanceThreshold, affordabilityBonus, typeMatchFloor);
    }

    // Getters
    public String getCatalogPath() {
        return catalogPath;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public int getMaxTopK() {
        return maxTopK;
    }

    public int getAffordableCeiling() {
        return affordableCeiling;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
