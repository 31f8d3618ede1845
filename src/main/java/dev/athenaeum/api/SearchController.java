package dev.athenaeum.api;

import dev.athenaeum.search.InvalidQueryException;
import dev.athenaeum.search.Principal;
import dev.athenaeum.search.RankedResults;
import dev.athenaeum.search.SearchFilters;
import dev.athenaeum.search.SearchProperties;
import dev.athenaeum.search.SearchRequest;
import dev.athenaeum.search.SearchService;
import java.time.Duration;
import java.time.Instant;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for {@code search(query, filters, principal, asOf?, page)}.
 *
 * <p>Claims are read from trusted identity headers; failures are rendered as Problem Details by
 * {@link dev.athenaeum.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/search")
public class SearchController {

  private final SearchService searchService;
  private final SearchProperties searchProperties;

  public SearchController(SearchService searchService, SearchProperties searchProperties) {
    this.searchService = searchService;
    this.searchProperties = searchProperties;
  }

  @GetMapping
  public RankedResults search(
      @RequestParam("q") String query,
      @RequestParam(required = false) @Nullable String category,
      @RequestParam(required = false) @Nullable String tag,
      @RequestParam(required = false) @Nullable String sourceType,
      @RequestParam(required = false) @Nullable Instant asOf,
      @RequestParam(defaultValue = "0") int offset,
      @RequestParam(required = false) @Nullable Integer limit,
      @RequestHeader(value = PrincipalHeaders.PRINCIPAL_ID, required = false) @Nullable String principalId,
      @RequestHeader(value = PrincipalHeaders.ROLES, required = false) @Nullable String roles,
      @RequestHeader(value = PrincipalHeaders.TENANTS, required = false) @Nullable String tenants) {
    Principal principal = Principal.fromCommaSeparated(principalId, roles, tenants);
    SearchRequest request =
        new SearchRequest(
            query,
            principal,
            new SearchFilters(category, tag, sourceType),
            asOf,
            offset,
            limit != null ? limit : searchProperties.getDefaultPageSize(),
            null);
    return searchService.search(request);
  }

  @PostMapping
  public RankedResults search(
      @RequestBody SearchQueryBody body,
      @RequestHeader(value = PrincipalHeaders.PRINCIPAL_ID, required = false) @Nullable String principalId,
      @RequestHeader(value = PrincipalHeaders.ROLES, required = false) @Nullable String roles,
      @RequestHeader(value = PrincipalHeaders.TENANTS, required = false) @Nullable String tenants) {
    if (body.timeoutMs() != null && body.timeoutMs() <= 0) {
      throw new InvalidQueryException("timeoutMs must be positive");
    }
    Principal principal = Principal.fromCommaSeparated(principalId, roles, tenants);
    SearchRequest request =
        new SearchRequest(
            body.query(),
            principal,
            new SearchFilters(body.categoryId(), body.tag(), body.sourceType()),
            body.asOf(),
            body.offset() != null ? body.offset() : 0,
            body.limit() != null ? body.limit() : searchProperties.getDefaultPageSize(),
            body.timeoutMs() != null ? Duration.ofMillis(body.timeoutMs()) : null);
    return searchService.search(request);
  }
}
