package dev.athenaeum.mcp;

import dev.athenaeum.search.Principal;
import dev.athenaeum.search.RankedResults;
import dev.athenaeum.search.SearchException;
import dev.athenaeum.search.SearchFilters;
import dev.athenaeum.search.SearchProperties;
import dev.athenaeum.search.SearchRequest;
import dev.athenaeum.search.SearchService;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the knowledge base as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code search_knowledge}, {@code invalidate_content}.
 *
 * @see TokenBudgetTruncator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final SearchService searchService;
  private final SearchProperties searchProperties;
  private final TokenBudgetTruncator truncator;

  public McpToolService(
      SearchService searchService,
      SearchProperties searchProperties,
      TokenBudgetTruncator truncator) {
    this.searchService = searchService;
    this.searchProperties = searchProperties;
    this.truncator = truncator;
  }

  /** Hybrid search over the knowledge base on behalf of the given claims. */
  @Tool(
      name = "search_knowledge",
      description =
          "Search the knowledge base by keyword and meaning. "
              + "Returns ranked excerpts with titles, version numbers and validity periods. "
              + "Results are limited to what the given roles and tenants may read.")
  public String searchKnowledge(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Comma-separated role claims of the caller", required = false)
          @Nullable String roles,
      @ToolParam(description = "Comma-separated tenant claims of the caller", required = false)
          @Nullable String tenants,
      @ToolParam(description = "Filter by category id", required = false) @Nullable String category,
      @ToolParam(description = "Filter by tag", required = false) @Nullable String tag,
      @ToolParam(description = "Filter by source type, e.g. 'manual'", required = false)
          @Nullable String sourceType,
      @ToolParam(
              description = "Resolve versions as of this ISO-8601 instant (default: now)",
              required = false)
          @Nullable String asOf,
      @ToolParam(description = "Maximum number of results (1-50, default 10)", required = false)
          @Nullable Integer maxResults) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      Principal principal = Principal.fromCommaSeparated(null, roles, tenants);
      SearchFilters filters = new SearchFilters(category, tag, sourceType);
      Instant asOfInstant = asOf != null && !asOf.isBlank() ? Instant.parse(asOf.strip()) : null;
      RankedResults ranked =
          searchService.search(
              new SearchRequest(
                  query, principal, filters, asOfInstant, 0, clampMaxResults(maxResults), null));

      if (ranked.results().isEmpty()) {
        return buildEmptyResultMessage(query, filters);
      }
      String body = truncator.truncate(ranked.results());
      return ranked.degraded()
          ? "Note: partial results (one retrieval source unavailable).\n\n" + body
          : body;
    } catch (DateTimeParseException e) {
      return "Error: asOf must be an ISO-8601 instant, e.g. 2024-01-31T00:00:00Z";
    } catch (SearchException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("search_knowledge failed", e);
      return "Error searching knowledge base: " + e.getMessage();
    }
  }

  /** Drops cached results referencing a content item. */
  @Tool(
      name = "invalidate_content",
      description =
          "Drop every cached search result that references the given content item. "
              + "Use after editing content outside the normal indexing path.")
  public String invalidateContent(
      @ToolParam(description = "Content item UUID") @Nullable String contentItemId) {
    try {
      if (contentItemId == null || contentItemId.isBlank()) {
        return "Error: contentItemId must not be empty.";
      }
      UUID id = UUID.fromString(contentItemId.strip());
      int dropped = searchService.invalidate(id);
      return "Invalidated %d cached result page(s) for content item %s.".formatted(dropped, id);
    } catch (IllegalArgumentException e) {
      return "Error: '" + contentItemId + "' is not a valid UUID.";
    } catch (Exception e) {
      log.warn("invalidate_content failed", e);
      return "Error invalidating content: " + e.getMessage();
    }
  }

  private int clampMaxResults(@Nullable Integer maxResults) {
    if (maxResults == null || maxResults < 1) {
      return searchProperties.getDefaultPageSize();
    }
    return Math.min(maxResults, searchProperties.getMaxPageSize());
  }

  private static String buildEmptyResultMessage(String query, SearchFilters filters) {
    List<String> activeFilters = new ArrayList<>();
    if (filters.categoryId() != null) {
      activeFilters.add("category='" + filters.categoryId() + "'");
    }
    if (filters.tag() != null) {
      activeFilters.add("tag='" + filters.tag() + "'");
    }
    if (filters.sourceType() != null) {
      activeFilters.add("sourceType='" + filters.sourceType() + "'");
    }
    if (activeFilters.isEmpty()) {
      return "No results found for query: " + query;
    }
    return "No results for query '%s' with filters [%s]."
        .formatted(query, String.join(", ", activeFilters));
  }
}
