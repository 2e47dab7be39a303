package de.mirkosertic.mcp.travelserver.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time from the Maven-filtered build-info.properties.
 * Reports "dev"/"unknown" when the file is missing or still unfiltered, e.g. inside an IDE.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String VERSION_KEY = "build.version";
    private static final String TIMESTAMP_KEY = "build.timestamp";
    private static final String DEV_VERSION = "dev";
    private static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("{} not found, running in dev mode", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to read {}, using defaults", BUILD_INFO_FILE, e);
        }
        version = filtered(props.getProperty(VERSION_KEY), DEV_VERSION);
        buildTimestamp = filtered(props.getProperty(TIMESTAMP_KEY), UNKNOWN_TIMESTAMP);
        logger.debug("Build info: version={}, timestamp={}", version, buildTimestamp);
    }

    private BuildInfo() {
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }

    /**
     * Version and build time in one line, e.g. {@code 1.0.0 (built 2025-01-01T10:00:00Z)}.
     */
    public static String describe() {
        return version + " (built " + buildTimestamp + ")";
    }

    // An unfiltered placeholder such as ${project.version} counts as missing
    static String filtered(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }
}
