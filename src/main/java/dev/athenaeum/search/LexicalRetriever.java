package dev.athenaeum.search;

import dev.athenaeum.content.ContentVersionRepository;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Lexical branch: PostgreSQL full-text search over version snapshots valid at the as-of instant,
 * scored by {@code ts_rank_cd}.
 */
@Component
public class LexicalRetriever {

  private final ContentVersionRepository contentVersionRepository;

  public LexicalRetriever(ContentVersionRepository contentVersionRepository) {
    this.contentVersionRepository = contentVersionRepository;
  }

  /**
   * Returns up to {@code topK} lexical candidates, best first.
   *
   * @param normalisedQuery normalised query text
   * @param filters metadata filters
   * @param asOf instant the snapshots must be valid at
   * @param topK maximum candidates
   * @return raw-scored candidates
   */
  List<ScoredCandidate> retrieve(
      String normalisedQuery, SearchFilters filters, Instant asOf, int topK) {
    List<Object[]> rows =
        contentVersionRepository.fullTextSearch(
            normalisedQuery,
            filters.categoryId(),
            filters.tag(),
            filters.sourceType(),
            asOf,
            topK);
    return rows.stream().map(LexicalRetriever::toCandidate).toList();
  }

  /** Maps a {@code [version_id, content_item_id, valid_from, score]} row. */
  static ScoredCandidate toCandidate(Object[] row) {
    UUID versionId = toUuid(row[0]);
    UUID contentItemId = toUuid(row[1]);
    Instant validFrom = toInstant(row[2]);
    double score = ((Number) row[3]).doubleValue();
    return new ScoredCandidate(contentItemId, versionId, validFrom, score);
  }

  private static UUID toUuid(Object value) {
    if (value instanceof UUID uuid) {
      return uuid;
    }
    return UUID.fromString(value.toString());
  }

  private static Instant toInstant(Object value) {
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof OffsetDateTime odt) {
      return odt.toInstant();
    }
    if (value instanceof Timestamp ts) {
      return ts.toInstant();
    }
    throw new IllegalArgumentException("Unsupported timestamp column type: " + value.getClass());
  }
}
