package de.mirkosertic.mcp.travelserver;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.travelserver.catalog.CatalogStore;
import de.mirkosertic.mcp.travelserver.config.ApplicationConfig;
import de.mirkosertic.mcp.travelserver.config.BuildInfo;
import de.mirkosertic.mcp.travelserver.config.LoggingConfigurator;
import de.mirkosertic.mcp.travelserver.index.DestinationIndexer;
import de.mirkosertic.mcp.travelserver.mcp.LatestProtocolStdioServerTransportProvider;
import de.mirkosertic.mcp.travelserver.query.ConstraintExtractor;
import de.mirkosertic.mcp.travelserver.ranking.DestinationRanker;
import de.mirkosertic.mcp.travelserver.ranking.RankingWeights;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Main entry point for the travel recommendation server.
 * Wires the recommendation pipeline and serves it as MCP tools over STDIO.
 */
public class TravelserverApplication {

    private static final Logger logger = LoggerFactory.getLogger(TravelserverApplication.class);

    private final TravelRecommendationService recommendationService;
    private final TravelSearchTools searchTools;
    private McpSyncServer mcpServer;

    public TravelserverApplication(final ApplicationConfig config) {
        final CatalogStore catalogStore = new CatalogStore(Paths.get(config.getCatalogPath()));
        final DestinationIndexer indexer = new DestinationIndexer();
        final RankingWeights weights = config.getRankingWeights();
        if (!weights.isNormalized()) {
            logger.warn("Ranking weights sum to {} instead of 1.0, scores are off the scale of relevance threshold {}",
                    weights.totalWithDuration(), weights.relevanceThreshold());
        }

        this.recommendationService = new TravelRecommendationService(
                catalogStore,
                indexer,
                new ConstraintExtractor(config.getAffordableCeiling()),
                new DestinationRanker(indexer, weights)
        );

        this.searchTools = new TravelSearchTools(recommendationService, config);
    }

    /**
     * Load the catalog and build the first index generation.
     */
    public void init() throws IOException {
        logger.info("Initializing travel server {}...", BuildInfo.describe());
        recommendationService.init();
        logger.info("Serving {} destinations", recommendationService.catalogStats().destinationCount());
    }

    /**
     * Start the MCP server and block until the process is stopped.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Travel Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final LatestProtocolStdioServerTransportProvider transportProvider =
                new LatestProtocolStdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(searchTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    public void shutdown() {
        logger.info("Shutting down MCP Travel Server...");
        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final RuntimeException e) {
            logger.error("Error closing MCP server", e);
        }
        logger.info("MCP Travel Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging first, STDOUT belongs to JSON-RPC in deployed mode
            final boolean deployedMode = "deployed".equals(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Catalog path: {}", config.getCatalogPath());
            }

            final TravelserverApplication app = new TravelserverApplication(config);
            app.init();
            app.start();

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP Travel Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
