package de.mirkosertic.mcp.travelserver;

import de.mirkosertic.mcp.travelserver.catalog.CatalogFormatException;
import de.mirkosertic.mcp.travelserver.catalog.Destination;
import de.mirkosertic.mcp.travelserver.config.ApplicationConfig;
import de.mirkosertic.mcp.travelserver.config.BuildInfo;
import de.mirkosertic.mcp.travelserver.mcp.SchemaGenerator;
import de.mirkosertic.mcp.travelserver.mcp.ToolResultHelper;
import de.mirkosertic.mcp.travelserver.mcp.dto.AddDestinationRequest;
import de.mirkosertic.mcp.travelserver.mcp.dto.AddDestinationResponse;
import de.mirkosertic.mcp.travelserver.mcp.dto.CatalogStatsResponse;
import de.mirkosertic.mcp.travelserver.mcp.dto.DestinationSummary;
import de.mirkosertic.mcp.travelserver.mcp.dto.ExplainScoreRequest;
import de.mirkosertic.mcp.travelserver.mcp.dto.ExplainScoreResponse;
import de.mirkosertic.mcp.travelserver.mcp.dto.ListDestinationsResponse;
import de.mirkosertic.mcp.travelserver.mcp.dto.RecommendRequest;
import de.mirkosertic.mcp.travelserver.mcp.dto.RecommendResponse;
import de.mirkosertic.mcp.travelserver.mcp.dto.RemoveDestinationRequest;
import de.mirkosertic.mcp.travelserver.mcp.dto.SimpleMessageResponse;
import de.mirkosertic.mcp.travelserver.ranking.ScoreExplanation;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MCP tools for travel recommendations and catalog maintenance.
 */
public class TravelSearchTools {

    private static final Logger logger = LoggerFactory.getLogger(TravelSearchTools.class);

    private static final String RECOMMEND_DESCRIPTION = """
            Recommend travel destinations for a free-text wish. \
            The query is parsed into constraints: budget (e.g. 'budget 5000', 'under rs 4000', '3000-6000', \
            or 'cheap' for an affordable default), moods (adventure, nature, relaxing, party, cultural, history, \
            spiritual, romantic), duration ('4 days'), distance ('within 800 km'), months or seasons \
            ('december', 'winter', 'monsoon') and known place names (goa, manali, ladakh, ...). \
            Destinations outside an explicit budget or not matching a requested type such as 'beach' or \
            'mountain' are excluded. Returns ranked results with scores and the parsed constraints; \
            set explain=true for a per-factor score breakdown.""";

    private final TravelRecommendationService recommendationService;
    private final ApplicationConfig config;

    public TravelSearchTools(final TravelRecommendationService recommendationService,
                             final ApplicationConfig config) {
        this.recommendationService = recommendationService;
        this.config = config;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("recommend")
                        .description(RECOMMEND_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(RecommendRequest.class))
                        .build())
                .callHandler((exchange, request) -> recommend(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("explainScore")
                        .description("Explain how a single destination scores for a query, factor by factor. "
                                + "Also reports whether the destination would be excluded and why.")
                        .inputSchema(SchemaGenerator.generateSchema(ExplainScoreRequest.class))
                        .build())
                .callHandler((exchange, request) -> explainScore(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("listDestinations")
                        .description("List every destination in the catalog with budget, duration, distance, "
                                + "rating, moods and best months.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> listDestinations())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("addDestination")
                        .description("Add a destination to the catalog. The catalog file is updated and the "
                                + "index is rebuilt before this call returns.")
                        .inputSchema(SchemaGenerator.generateSchema(AddDestinationRequest.class))
                        .build())
                .callHandler((exchange, request) -> addDestination(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("removeDestination")
                        .description("Remove a destination from the catalog by id. The index is rebuilt before "
                                + "this call returns.")
                        .inputSchema(SchemaGenerator.generateSchema(RemoveDestinationRequest.class))
                        .build())
                .callHandler((exchange, request) -> removeDestination(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getCatalogStats")
                        .description("Get statistics about the served catalog: destination count, distinct "
                                + "indexed terms, destinations per mood and the index generation.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getCatalogStats())
                .build());

        return tools;
    }

    McpSchema.CallToolResult recommend(final Map<String, Object> args) {
        final RecommendRequest request = RecommendRequest.fromMap(args);

        logger.info("Recommend request: query='{}', topK={}, explain={}",
                request.query(), request.topK(), request.explain());

        if (request.query() == null) {
            return ToolResultHelper.createResult(RecommendResponse.error("Missing required parameter: query"));
        }

        final long startTime = System.currentTimeMillis();
        try {
            final int topK = request.effectiveTopK(config.getDefaultTopK(), config.getMaxTopK());
            final RecommendationResult result = request.effectiveExplain()
                    ? recommendationService.recommendWithExplanation(request.query(), topK)
                    : recommendationService.recommend(request.query(), topK);
            final long duration = System.currentTimeMillis() - startTime;

            logger.info("Recommend completed in {}ms: {} results", duration, result.totalResults());
            return ToolResultHelper.createResult(RecommendResponse.success(result, duration));

        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid recommend request: {}", e.getMessage());
            return ToolResultHelper.createResult(RecommendResponse.error("Invalid request: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult explainScore(final Map<String, Object> args) {
        final ExplainScoreRequest request = ExplainScoreRequest.fromMap(args);

        logger.info("Explain score request: query='{}', destinationId={}", request.query(), request.destinationId());

        if (request.query() == null || request.destinationId() == null) {
            return ToolResultHelper.createResult(
                    ExplainScoreResponse.error("Missing required parameters: query and destinationId"));
        }

        final Optional<ScoreExplanation> explanation =
                recommendationService.explain(request.query(), request.destinationId());
        if (explanation.isEmpty()) {
            logger.warn("Explain score for unknown destination {}", request.destinationId());
            return ToolResultHelper.createResult(
                    ExplainScoreResponse.error("Destination not found: " + request.destinationId()));
        }
        return ToolResultHelper.createResult(ExplainScoreResponse.success(explanation.get()));
    }

    McpSchema.CallToolResult listDestinations() {
        logger.info("List destinations request");

        final List<DestinationSummary> summaries = new ArrayList<>();
        for (final Destination destination : recommendationService.listDestinations()) {
            summaries.add(DestinationSummary.from(destination));
        }
        return ToolResultHelper.createResult(ListDestinationsResponse.success(summaries));
    }

    McpSchema.CallToolResult addDestination(final Map<String, Object> args) {
        final AddDestinationRequest request = AddDestinationRequest.fromMap(args);

        logger.info("Add destination request: name='{}'", request.name());

        try {
            final Destination created = recommendationService.addDestination(request.toDraft());
            return ToolResultHelper.createResult(AddDestinationResponse.success(
                    DestinationSummary.from(created), recommendationService.catalogStats().destinationCount()));

        } catch (final IllegalArgumentException e) {
            logger.warn("Invalid destination: {}", e.getMessage());
            return ToolResultHelper.createResult(AddDestinationResponse.error("Invalid destination: " + e.getMessage()));
        } catch (final CatalogFormatException e) {
            logger.error("Catalog file is corrupt, destination not added", e);
            return ToolResultHelper.createResult(AddDestinationResponse.error("Catalog error: " + e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error adding destination", e);
            return ToolResultHelper.createResult(AddDestinationResponse.error("Error adding destination: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult removeDestination(final Map<String, Object> args) {
        final RemoveDestinationRequest request = RemoveDestinationRequest.fromMap(args);

        logger.info("Remove destination request: id={}", request.destinationId());

        if (request.destinationId() == null) {
            return ToolResultHelper.createResult(SimpleMessageResponse.error("Missing required parameter: destinationId"));
        }

        try {
            final Optional<Destination> removed = recommendationService.removeDestination(request.destinationId());
            if (removed.isEmpty()) {
                logger.warn("Remove requested for unknown destination {}", request.destinationId());
                return ToolResultHelper.createResult(
                        SimpleMessageResponse.error("Destination not found: " + request.destinationId()));
            }
            return ToolResultHelper.createResult(SimpleMessageResponse.success(
                    "Removed destination '" + removed.get().name() + "' (id " + removed.get().id() + ")"));

        } catch (final CatalogFormatException e) {
            logger.error("Catalog file is corrupt, destination not removed", e);
            return ToolResultHelper.createResult(SimpleMessageResponse.error("Catalog error: " + e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error removing destination", e);
            return ToolResultHelper.createResult(SimpleMessageResponse.error("Error removing destination: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getCatalogStats() {
        logger.info("Catalog stats request");

        final CatalogStats stats = recommendationService.catalogStats();
        logger.info("Catalog stats: {} destinations, {} terms, generation {}",
                stats.destinationCount(), stats.distinctTerms(), stats.generation());
        return ToolResultHelper.createResult(
                CatalogStatsResponse.success(stats, BuildInfo.getVersion(), BuildInfo.getBuildTimestamp()));
    }
}
