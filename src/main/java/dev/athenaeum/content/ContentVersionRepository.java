package dev.athenaeum.content;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link ContentVersion} entities and the lexical index over them. */
public interface ContentVersionRepository extends JpaRepository<ContentVersion, UUID> {

  /**
   * Loads every version of the given items, in no particular order.
   *
   * @param contentItemIds the items to load versions for
   * @return all versions of those items
   */
  List<ContentVersion> findByContentItemIdIn(Collection<UUID> contentItemIds);

  /**
   * Lists the revision history of an item.
   *
   * @param contentItemId the item
   * @return every version of the item, oldest first
   */
  List<ContentVersion> findByContentItemIdOrderByVersionNumberAsc(UUID contentItemId);

  /**
   * Finds the open-ended version of an item.
   *
   * @param contentItemId the item
   * @return the current version, or empty if the item is retired or unknown
   */
  Optional<ContentVersion> findByContentItemIdAndValidToIsNull(UUID contentItemId);

  /**
   * Full-text search over version snapshots valid at {@code asOf}, ranked by {@code ts_rank_cd}
   * (cover density, normalised by document length).
   *
   * <p>{@code websearch_to_tsquery} keeps quoted phrases as phrase queries, so exact-phrase
   * (factual) queries match on adjacency rather than on loose terms.
   *
   * @param query normalised query text
   * @param categoryId optional category filter (exact match)
   * @param tag optional tag filter, matched as a whole element of the item's comma-separated
   *     tags
   * @param sourceType optional source type filter (exact match)
   * @param asOf the instant the snapshots must be valid at
   * @param limit maximum rows
   * @return rows of {@code [version_id, content_item_id, valid_from, score]}, best first
   */
  @Query(
      value =
          """
            SELECT v.id AS version_id,
                   v.content_item_id,
                   v.valid_from,
                   ts_rank_cd(v.search_vector, websearch_to_tsquery('english', :query), 32) AS score
            FROM content_versions v
            JOIN content_items i ON i.id = v.content_item_id
            WHERE v.search_vector @@ websearch_to_tsquery('english', :query)
              AND v.valid_from <= :asOf
              AND (v.valid_to IS NULL OR v.valid_to > :asOf)
              AND (CAST(:categoryId AS text) IS NULL OR i.category_id = CAST(:categoryId AS text))
              AND (CAST(:sourceType AS text) IS NULL OR i.source_type = CAST(:sourceType AS text))
              AND (CAST(:tag AS text) IS NULL
                   OR string_to_array(i.tags, ',') @> ARRAY[CAST(:tag AS text)])
            ORDER BY score DESC, v.id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> fullTextSearch(
      @Param("query") String query,
      @Param("categoryId") @Nullable String categoryId,
      @Param("tag") @Nullable String tag,
      @Param("sourceType") @Nullable String sourceType,
      @Param("asOf") Instant asOf,
      @Param("limit") int limit);

  /**
   * Writes the end of validity into the snapshot's embedding metadata so that vector search stops
   * matching it for as-of times at or after {@code validToMillis}.
   *
   * @param versionId the version (and embedding) id
   * @param validToMillis end of validity in epoch milliseconds
   */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            UPDATE content_embeddings
            SET metadata = jsonb_set(COALESCE(metadata, '{}'::jsonb), '{valid_to}', to_jsonb(CAST(:validTo AS bigint)))
            WHERE embedding_id = :versionId
            """,
      nativeQuery = true)
  void updateEmbeddingValidTo(
      @Param("versionId") UUID versionId, @Param("validTo") long validToMillis);
}
