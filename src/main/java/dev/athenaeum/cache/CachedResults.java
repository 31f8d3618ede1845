package dev.athenaeum.cache;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A cached result page. Holds version references and scores only; text is re-read from the
 * versions at hit time so that a stale reference is detected instead of served.
 *
 * @param hits ranked hits, best first
 * @param queryType name of the query classification the page was computed with
 * @param computedAt when the page was computed
 */
public record CachedResults(List<Hit> hits, String queryType, Instant computedAt) {

  public CachedResults {
    hits = List.copyOf(hits);
  }

  /** Distinct content items referenced by this page. */
  public Set<UUID> contentItemIds() {
    return hits.stream().map(Hit::contentItemId).collect(Collectors.toUnmodifiableSet());
  }

  /**
   * One ranked reference.
   *
   * @param contentItemId the item
   * @param versionId the version resolved when the page was computed
   * @param contentHash the snapshot hash of that version
   * @param score fused score
   * @param semanticScore normalised semantic component
   * @param lexicalScore normalised lexical component
   */
  public record Hit(
      UUID contentItemId,
      UUID versionId,
      String contentHash,
      double score,
      double semanticScore,
      double lexicalScore) {}
}
