package dev.athenaeum.content;

import dev.langchain4j.data.document.Metadata;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Metadata layout of a version snapshot in the embedding store. The embedding id is the version
 * id; instants are stored as epoch milliseconds so that range filters compare numerically.
 */
public final class EmbeddingMetadata {

  public static final String CONTENT_ITEM_ID = "content_item_id";
  public static final String VERSION_ID = "version_id";
  public static final String VALID_FROM = "valid_from";
  public static final String VALID_TO = "valid_to";
  public static final String CATEGORY_ID = "category_id";
  public static final String TAGS = "tags";
  public static final String SOURCE_TYPE = "source_type";

  /** Stored {@code valid_to} of a version that is still current. */
  public static final long OPEN_ENDED = Long.MAX_VALUE;

  private EmbeddingMetadata() {}

  /** Builds the metadata for a version snapshot of {@code item}. */
  public static Metadata forVersion(ContentItem item, ContentVersion version) {
    Metadata metadata =
        new Metadata()
            .put(CONTENT_ITEM_ID, item.getId().toString())
            .put(VERSION_ID, version.getId().toString())
            .put(VALID_FROM, version.getValidFrom().toEpochMilli())
            .put(VALID_TO, toMillis(version.getValidTo()))
            .put(TAGS, tagsToken(item.getTagList()))
            .put(SOURCE_TYPE, item.getSourceType());
    if (item.getCategoryId() != null) {
      metadata.put(CATEGORY_ID, item.getCategoryId());
    }
    return metadata;
  }

  /**
   * Renders tags as {@code ,a,b,} so that a single tag can be matched with a substring test on
   * {@code ,tag,}.
   */
  public static String tagsToken(List<String> tags) {
    return tags.isEmpty() ? "," : "," + String.join(",", tags) + ",";
  }

  /** Substring that a tags token contains iff it carries {@code tag}. */
  public static String tagNeedle(String tag) {
    return "," + tag.strip() + ",";
  }

  public static long toMillis(@Nullable Instant validTo) {
    return validTo == null ? OPEN_ENDED : validTo.toEpochMilli();
  }
}
