package de.mirkosertic.mcp.travelserver.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to file-only output when running as a STDIO server.
 * <p>
 * STDOUT carries the MCP JSON-RPC stream in deployed mode, so nothing else may be written there.
 * The development setup keeps the console configuration from logback.xml.
 */
public final class LoggingConfigurator {

    static final Path LOG_DIR = ApplicationConfig.getConfigDirectory().resolve("log");
    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is used.
     *
     * @param deployedMode true when serving MCP over STDIO
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            ensureLogDirectoryExists();
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    private static void ensureLogDirectoryExists() {
        try {
            Files.createDirectories(LOG_DIR);
        } catch (final IOException e) {
            // Logging is not set up yet, STDERR is the only channel left
            System.err.println("Warning: Could not create log directory " + LOG_DIR + ": " + e.getMessage());
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath, keeping default logging");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
