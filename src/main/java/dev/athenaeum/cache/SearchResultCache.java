package dev.athenaeum.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Bounded result-page cache with per-entry TTL and invalidation by content item.
 *
 * <p>Each entry lives for the duration of its {@link TtlClass}. A reverse index from content item to
 * cache keys lets {@link #invalidate(UUID)} drop every page referencing an item without scanning the
 * whole cache. Expired entries are never returned; the scheduled {@link #sweep()} only reclaims
 * their memory.
 */
@Component
public class SearchResultCache {

  private static final Logger log = LoggerFactory.getLogger(SearchResultCache.class);

  private final CacheProperties properties;
  private final Cache<CacheKey, Entry> pages;
  private final ConcurrentHashMap<UUID, Set<CacheKey>> keysByContentItem =
      new ConcurrentHashMap<>();

  public SearchResultCache(CacheProperties properties, Clock clock) {
    this.properties = properties;
    this.pages =
        Caffeine.newBuilder()
            .maximumSize(properties.getMaxEntries())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .expireAfter(new TtlClassExpiry())
            .removalListener(this::onRemoval)
            .build();
  }

  /** Returns the live page for {@code key}, if any. */
  public Optional<CachedResults> get(CacheKey key) {
    Entry entry = pages.getIfPresent(key);
    return entry == null ? Optional.empty() : Optional.of(entry.results());
  }

  /** Stores a page; it expires after the lifetime configured for {@code ttlClass}. */
  public void put(CacheKey key, CachedResults results, TtlClass ttlClass) {
    pages.put(key, new Entry(results, ttlClass));
    for (UUID contentItemId : results.contentItemIds()) {
      keysByContentItem.computeIfAbsent(contentItemId, id -> ConcurrentHashMap.newKeySet()).add(key);
    }
  }

  /** Drops a single page, used when a hit fails revalidation. */
  public void evict(CacheKey key) {
    pages.invalidate(key);
  }

  /**
   * Drops every page that references the given content item.
   *
   * @return number of pages dropped
   */
  public int invalidate(UUID contentItemId) {
    Set<CacheKey> keys = keysByContentItem.remove(contentItemId);
    if (keys == null || keys.isEmpty()) {
      return 0;
    }
    pages.invalidateAll(keys);
    log.debug("Invalidated {} cached page(s) referencing content item {}", keys.size(), contentItemId);
    return keys.size();
  }

  /** Drops everything. */
  public void invalidateAll() {
    pages.invalidateAll();
    keysByContentItem.clear();
  }

  /** Approximate number of live pages. */
  public long estimatedSize() {
    return pages.estimatedSize();
  }

  @Scheduled(fixedDelayString = "${athenaeum.cache.sweep-interval-ms:300000}")
  public void sweep() {
    pages.cleanUp();
    log.trace("Result cache sweep done, {} page(s) live", pages.estimatedSize());
  }

  private void onRemoval(@Nullable CacheKey key, @Nullable Entry entry, RemovalCause cause) {
    if (key == null || entry == null || cause == RemovalCause.REPLACED) {
      return;
    }
    if (pages.asMap().containsKey(key)) {
      return;
    }
    for (UUID contentItemId : entry.results().contentItemIds()) {
      keysByContentItem.computeIfPresent(
          contentItemId,
          (id, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
          });
    }
  }

  private record Entry(CachedResults results, TtlClass ttlClass) {}

  private final class TtlClassExpiry implements Expiry<CacheKey, Entry> {

    @Override
    public long expireAfterCreate(CacheKey key, Entry entry, long currentTime) {
      return properties.ttlFor(entry.ttlClass()).toNanos();
    }

    @Override
    public long expireAfterUpdate(
        CacheKey key, Entry entry, long currentTime, long currentDuration) {
      return properties.ttlFor(entry.ttlClass()).toNanos();
    }

    @Override
    public long expireAfterRead(CacheKey key, Entry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
