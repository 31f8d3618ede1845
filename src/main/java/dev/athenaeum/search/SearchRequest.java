package dev.athenaeum.search;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Domain request for one search call.
 *
 * @param query the raw query text (must not be null or blank)
 * @param principal the caller's claims
 * @param filters optional metadata filters
 * @param asOf instant to resolve versions at; null means now
 * @param offset zero-based index of the first result in the page (must be >= 0)
 * @param limit page size (must be >= 1; the upper bound is configuration)
 * @param timeout per-request deadline; null means the configured default
 */
public record SearchRequest(
    String query,
    Principal principal,
    SearchFilters filters,
    @Nullable Instant asOf,
    int offset,
    int limit,
    @Nullable Duration timeout) {

  /** Default page size when not specified. */
  private static final int DEFAULT_LIMIT = 10;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null || query.isBlank()) {
      throw new InvalidQueryException("Query must not be blank");
    }
    Objects.requireNonNull(principal, "principal");
    if (filters == null) {
      filters = SearchFilters.none();
    }
    if (offset < 0) {
      throw new InvalidQueryException("offset must be >= 0");
    }
    if (limit < 1) {
      throw new InvalidQueryException("limit must be at least 1");
    }
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new InvalidQueryException("timeout must be positive");
    }
  }

  /** Convenience constructor: first page of default size, no filters, as of now. */
  public SearchRequest(String query, Principal principal) {
    this(query, principal, SearchFilters.none(), null, 0, DEFAULT_LIMIT, null);
  }

  /** Convenience constructor with filters and page bounds, as of now. */
  public SearchRequest(
      String query, Principal principal, SearchFilters filters, int offset, int limit) {
    this(query, principal, filters, null, offset, limit, null);
  }
}
