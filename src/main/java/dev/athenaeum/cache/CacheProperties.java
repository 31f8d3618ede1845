package dev.athenaeum.cache;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the result and query caches.
 *
 * <p>Properties are bound from {@code athenaeum.cache.*}.
 *
 * <ul>
 *   <li>{@code common-ttl} - lifetime of pages for frequently seen queries (default 24h)
 *   <li>{@code rare-ttl} - lifetime of all other pages (default 1h)
 *   <li>{@code common-threshold} - lookups within the window that promote a query to common
 *       (default 5)
 *   <li>{@code frequency-window} - sliding window for the lookup counter (default 1h)
 *   <li>{@code max-entries} - upper bound on cached pages (default 10000)
 *   <li>{@code max-tracked-queries} - upper bound on lookup counters (default 50000)
 *   <li>{@code embedding-ttl} - lifetime of memoised query embeddings (default 1h)
 *   <li>{@code embedding-max-entries} - upper bound on memoised query embeddings (default 2000)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "athenaeum.cache")
public class CacheProperties {

  private Duration commonTtl = Duration.ofHours(24);
  private Duration rareTtl = Duration.ofHours(1);
  private int commonThreshold = 5;
  private Duration frequencyWindow = Duration.ofHours(1);
  private long maxEntries = 10_000;
  private long maxTrackedQueries = 50_000;
  private Duration embeddingTtl = Duration.ofHours(1);
  private long embeddingMaxEntries = 2_000;

  @PostConstruct
  void validate() {
    requirePositive("common-ttl", commonTtl);
    requirePositive("rare-ttl", rareTtl);
    requirePositive("frequency-window", frequencyWindow);
    requirePositive("embedding-ttl", embeddingTtl);
    if (commonThreshold < 1) {
      throw new IllegalStateException(
          "athenaeum.cache.common-threshold must be >= 1, got: " + commonThreshold);
    }
    if (maxEntries < 1 || maxTrackedQueries < 1 || embeddingMaxEntries < 1) {
      throw new IllegalStateException("athenaeum.cache size limits must be >= 1");
    }
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalStateException(
          "athenaeum.cache." + name + " must be a positive duration, got: " + value);
    }
  }

  /** Lifetime for the given class. */
  public Duration ttlFor(TtlClass ttlClass) {
    return ttlClass == TtlClass.COMMON ? commonTtl : rareTtl;
  }

  public Duration getCommonTtl() {
    return commonTtl;
  }

  public void setCommonTtl(Duration commonTtl) {
    this.commonTtl = commonTtl;
  }

  public Duration getRareTtl() {
    return rareTtl;
  }

  public void setRareTtl(Duration rareTtl) {
    this.rareTtl = rareTtl;
  }

  public int getCommonThreshold() {
    return commonThreshold;
  }

  public void setCommonThreshold(int commonThreshold) {
    this.commonThreshold = commonThreshold;
  }

  public Duration getFrequencyWindow() {
    return frequencyWindow;
  }

  public void setFrequencyWindow(Duration frequencyWindow) {
    this.frequencyWindow = frequencyWindow;
  }

  public long getMaxEntries() {
    return maxEntries;
  }

  public void setMaxEntries(long maxEntries) {
    this.maxEntries = maxEntries;
  }

  public long getMaxTrackedQueries() {
    return maxTrackedQueries;
  }

  public void setMaxTrackedQueries(long maxTrackedQueries) {
    this.maxTrackedQueries = maxTrackedQueries;
  }

  public Duration getEmbeddingTtl() {
    return embeddingTtl;
  }

  public void setEmbeddingTtl(Duration embeddingTtl) {
    this.embeddingTtl = embeddingTtl;
  }

  public long getEmbeddingMaxEntries() {
    return embeddingMaxEntries;
  }

  public void setEmbeddingMaxEntries(long embeddingMaxEntries) {
    this.embeddingMaxEntries = embeddingMaxEntries;
  }
}
