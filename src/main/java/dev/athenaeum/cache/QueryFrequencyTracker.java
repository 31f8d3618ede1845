package dev.athenaeum.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Counts lookups per normalised query over a sliding window and derives the {@link TtlClass} the
 * next computed page for that query should get.
 */
@Component
public class QueryFrequencyTracker {

  private final Clock clock;
  private final long windowMillis;
  private final int commonThreshold;
  private final Cache<String, LookupWindow> windows;

  public QueryFrequencyTracker(CacheProperties properties, Clock clock) {
    this.clock = clock;
    this.windowMillis = properties.getFrequencyWindow().toMillis();
    this.commonThreshold = properties.getCommonThreshold();
    this.windows =
        Caffeine.newBuilder()
            .maximumSize(properties.getMaxTrackedQueries())
            .expireAfterAccess(properties.getFrequencyWindow())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .build();
  }

  /** Records one lookup and returns the resulting class. */
  public TtlClass recordLookup(String normalisedQuery) {
    long now = clock.millis();
    int seen =
        windows
            .get(normalisedQuery, q -> new LookupWindow(commonThreshold))
            .record(now, windowMillis);
    return seen >= commonThreshold ? TtlClass.COMMON : TtlClass.RARE;
  }

  /** Timestamps of recent lookups, capped at the threshold since nothing above it matters. */
  private static final class LookupWindow {

    private final int capacity;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    LookupWindow(int capacity) {
      this.capacity = capacity;
    }

    synchronized int record(long now, long windowMillis) {
      long cutoff = now - windowMillis;
      while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
        timestamps.pollFirst();
      }
      timestamps.addLast(now);
      while (timestamps.size() > capacity) {
        timestamps.pollFirst();
      }
      return timestamps.size();
    }
  }
}
