package dev.athenaeum.search;

import org.jspecify.annotations.Nullable;

/**
 * Optional metadata filters. Blank values are treated as absent.
 *
 * @param categoryId exact match on the item's category
 * @param tag the item must carry this tag
 * @param sourceType exact match on the item's source type
 */
public record SearchFilters(
    @Nullable String categoryId, @Nullable String tag, @Nullable String sourceType) {

  private static final SearchFilters NONE = new SearchFilters(null, null, null);

  public SearchFilters {
    categoryId = blankToNull(categoryId);
    tag = blankToNull(tag);
    sourceType = blankToNull(sourceType);
  }

  public static SearchFilters none() {
    return NONE;
  }

  /** Canonical rendering used as a cache key component. */
  public String cacheToken() {
    return "category=" + nullToEmpty(categoryId)
        + "|tag=" + nullToEmpty(tag)
        + "|source=" + nullToEmpty(sourceType);
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }

  private static String nullToEmpty(@Nullable String value) {
    return value == null ? "" : value;
  }
}
