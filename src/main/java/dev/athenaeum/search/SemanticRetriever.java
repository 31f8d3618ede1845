package dev.athenaeum.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.athenaeum.cache.QueryEmbeddingCache;
import dev.athenaeum.content.EmbeddingMetadata;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.RelevanceScore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Semantic branch: nearest-neighbour search over version snapshot embeddings, restricted by
 * metadata to snapshots valid at the as-of instant.
 */
@Component
public class SemanticRetriever {

  private static final Logger log = LoggerFactory.getLogger(SemanticRetriever.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * queries (NOT to documents at indexing time) to improve retrieval relevance.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final QueryEmbeddingCache queryEmbeddingCache;
  private final SearchProperties searchProperties;

  public SemanticRetriever(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingModel embeddingModel,
      QueryEmbeddingCache queryEmbeddingCache,
      SearchProperties searchProperties) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
    this.queryEmbeddingCache = queryEmbeddingCache;
    this.searchProperties = searchProperties;
  }

  /**
   * Returns up to {@code topK} semantic candidates, best first.
   *
   * @param normalisedQuery normalised query text, also the embedding memo key
   * @param filters metadata filters
   * @param asOf instant the snapshots must be valid at
   * @param topK maximum candidates
   * @return relevance-scored candidates
   */
  List<ScoredCandidate> retrieve(
      String normalisedQuery, SearchFilters filters, Instant asOf, int topK) {
    Embedding queryEmbedding =
        queryEmbeddingCache.get(
            normalisedQuery, text -> embeddingModel.embed(BGE_QUERY_PREFIX + text).content());

    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(topK)
            .minScore(RelevanceScore.fromCosineSimilarity(searchProperties.getMinSimilarity()))
            .filter(buildFilter(filters, asOf))
            .build();

    List<ScoredCandidate> candidates = new ArrayList<>();
    for (EmbeddingMatch<TextSegment> match : embeddingStore.search(request).matches()) {
      ScoredCandidate candidate = toCandidate(match);
      if (candidate != null) {
        candidates.add(candidate);
      }
    }
    return candidates;
  }

  /**
   * Builds the metadata filter: validity at {@code asOf} plus the optional request filters,
   * combined with AND logic.
   */
  static Filter buildFilter(SearchFilters filters, Instant asOf) {
    long asOfMillis = asOf.toEpochMilli();
    Filter filter =
        metadataKey(EmbeddingMetadata.VALID_FROM)
            .isLessThanOrEqualTo(asOfMillis)
            .and(metadataKey(EmbeddingMetadata.VALID_TO).isGreaterThan(asOfMillis));

    if (filters.categoryId() != null) {
      filter = filter.and(metadataKey(EmbeddingMetadata.CATEGORY_ID).isEqualTo(filters.categoryId()));
    }
    if (filters.sourceType() != null) {
      filter = filter.and(metadataKey(EmbeddingMetadata.SOURCE_TYPE).isEqualTo(filters.sourceType()));
    }
    if (filters.tag() != null) {
      filter =
          filter.and(
              metadataKey(EmbeddingMetadata.TAGS)
                  .containsString(EmbeddingMetadata.tagNeedle(filters.tag())));
    }
    return filter;
  }

  private static @Nullable ScoredCandidate toCandidate(EmbeddingMatch<TextSegment> match) {
    if (match.embedded() == null) {
      log.warn("Embedding {} has no stored segment; skipping", match.embeddingId());
      return null;
    }
    Metadata metadata = match.embedded().metadata();
    String contentItemId = metadata.getString(EmbeddingMetadata.CONTENT_ITEM_ID);
    Long validFrom = metadata.getLong(EmbeddingMetadata.VALID_FROM);
    if (contentItemId == null || validFrom == null) {
      log.warn("Embedding {} lacks item metadata; skipping", match.embeddingId());
      return null;
    }
    return new ScoredCandidate(
        UUID.fromString(contentItemId),
        UUID.fromString(match.embeddingId()),
        Instant.ofEpochMilli(validFrom),
        match.score());
  }
}
