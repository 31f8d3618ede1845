package dev.athenaeum.cache;

import java.util.Objects;

/**
 * Key of a cached result page.
 *
 * <p>The access-scope fingerprint is a key component: a page computed for one scope can never be
 * served to a principal whose claims differ.
 *
 * @param normalisedQuery query text after normalisation
 * @param filters canonical rendering of the request filters
 * @param asOf {@code "now"} for current-time queries, otherwise the ISO-8601 as-of instant
 * @param offset page offset
 * @param limit page size
 * @param scopeFingerprint hash of the principal's effective access scope
 */
public record CacheKey(
    String normalisedQuery,
    String filters,
    String asOf,
    int offset,
    int limit,
    String scopeFingerprint) {

  public CacheKey {
    Objects.requireNonNull(normalisedQuery, "normalisedQuery");
    Objects.requireNonNull(filters, "filters");
    Objects.requireNonNull(asOf, "asOf");
    Objects.requireNonNull(scopeFingerprint, "scopeFingerprint");
  }
}
