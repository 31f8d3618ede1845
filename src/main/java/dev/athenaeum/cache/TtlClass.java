package dev.athenaeum.cache;

/**
 * Lifetime class of a cached result set, chosen from how often its normalised query has been seen
 * recently (see {@link QueryFrequencyTracker}).
 */
public enum TtlClass {
  /** Query seen at least the configured number of times within the frequency window. */
  COMMON,
  /** Anything else. */
  RARE
}
