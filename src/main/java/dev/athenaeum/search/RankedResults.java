package dev.athenaeum.search;

import java.time.Instant;
import java.util.List;

/**
 * A page of search results.
 *
 * @param results the page, best first
 * @param queryType how the query was classified
 * @param degraded true if only one retrieval branch contributed
 * @param cached true if the page was served from the result cache
 * @param asOf the instant versions were resolved at
 * @param offset index of the first result
 * @param limit requested page size
 */
public record RankedResults(
    List<SearchResult> results,
    QueryType queryType,
    boolean degraded,
    boolean cached,
    Instant asOf,
    int offset,
    int limit) {

  public RankedResults {
    results = List.copyOf(results);
  }
}
