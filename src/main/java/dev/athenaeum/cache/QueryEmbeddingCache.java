package dev.athenaeum.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.data.embedding.Embedding;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/** Memoises query embeddings by normalised query text. */
@Component
public class QueryEmbeddingCache {

  private final Cache<String, Embedding> embeddings;

  public QueryEmbeddingCache(CacheProperties properties, Clock clock) {
    this.embeddings =
        Caffeine.newBuilder()
            .maximumSize(properties.getEmbeddingMaxEntries())
            .expireAfterWrite(properties.getEmbeddingTtl())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .build();
  }

  /** Returns the memoised embedding, computing it with {@code loader} on a miss. */
  public Embedding get(String normalisedQuery, Function<String, Embedding> loader) {
    return embeddings.get(normalisedQuery, loader);
  }
}
