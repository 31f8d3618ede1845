package dev.athenaeum.ingestion;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * New text for a content item, as handed over by the editing collaborator.
 *
 * @param contentItemId the item to add a version to; null creates a new item
 * @param title version title (must not be blank)
 * @param summary optional version summary
 * @param text version body (must not be blank)
 * @param sourceType origin of the content, e.g. {@code manual} or {@code imported}
 * @param ownerId optional owner
 * @param tenantPath optional tenant scope; null makes the item platform-wide
 * @param requiredRoles roles of which the reader needs at least one; empty means any
 * @param categoryId optional category reference
 * @param tags tag names
 * @param validFrom start of validity of the new version; null means now
 * @param author optional author recorded on the version
 */
public record ContentDraft(
    @Nullable UUID contentItemId,
    String title,
    @Nullable String summary,
    String text,
    String sourceType,
    @Nullable String ownerId,
    @Nullable String tenantPath,
    List<String> requiredRoles,
    @Nullable String categoryId,
    List<String> tags,
    @Nullable Instant validFrom,
    @Nullable String author) {

  private static final String DEFAULT_SOURCE_TYPE = "manual";

  /** Compact constructor validating input. */
  public ContentDraft {
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("title must not be blank");
    }
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("text must not be blank");
    }
    if (sourceType == null || sourceType.isBlank()) {
      sourceType = DEFAULT_SOURCE_TYPE;
    }
    requiredRoles = requiredRoles == null ? List.of() : List.copyOf(requiredRoles);
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  /** Convenience constructor for a new, platform-wide item with no metadata. */
  public ContentDraft(String title, @Nullable String summary, String text) {
    this(null, title, summary, text, DEFAULT_SOURCE_TYPE, null, null, List.of(), null, List.of(),
        null, null);
  }
}
