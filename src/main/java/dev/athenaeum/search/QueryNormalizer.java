package dev.athenaeum.search;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pure static utility turning raw query text into the canonical form used for retrieval, cache keys
 * and frequency counting.
 */
public final class QueryNormalizer {

  private static final Pattern CONTROL = Pattern.compile("\\p{Cntrl}");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private QueryNormalizer() {}

  /**
   * Strips control characters, trims, collapses runs of whitespace to one space and case-folds.
   *
   * @param raw the query as received
   * @return the normalised query, never empty
   * @throws InvalidQueryException if nothing is left after normalisation
   */
  public static String normalise(String raw) {
    if (raw == null) {
      throw new InvalidQueryException("Query must not be empty");
    }
    String stripped = CONTROL.matcher(raw).replaceAll(" ");
    String collapsed = WHITESPACE.matcher(stripped.strip()).replaceAll(" ");
    if (collapsed.isEmpty()) {
      throw new InvalidQueryException("Query must not be empty");
    }
    return collapsed.toLowerCase(Locale.ROOT);
  }
}
