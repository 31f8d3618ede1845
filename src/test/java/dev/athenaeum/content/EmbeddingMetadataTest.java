package dev.athenaeum.content;

import static org.assertj.core.api.Assertions.assertThat;

import dev.athenaeum.fixture.ContentItemBuilder;
import dev.athenaeum.fixture.ContentVersionBuilder;
import dev.langchain4j.data.document.Metadata;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class EmbeddingMetadataTest {

  @Test
  void current_version_is_stored_open_ended() {
    ContentItem item =
        new ContentItemBuilder().categoryId("cat-7").tags("geo", "maps").sourceType("imported").build();
    Instant from = Instant.parse("2024-01-01T00:00:00Z");
    ContentVersion version =
        new ContentVersionBuilder().contentItemId(item.getId()).validFrom(from).build();

    Metadata metadata = EmbeddingMetadata.forVersion(item, version);

    assertThat(metadata.getString(EmbeddingMetadata.CONTENT_ITEM_ID))
        .isEqualTo(item.getId().toString());
    assertThat(metadata.getString(EmbeddingMetadata.VERSION_ID))
        .isEqualTo(version.getId().toString());
    assertThat(metadata.getLong(EmbeddingMetadata.VALID_FROM)).isEqualTo(from.toEpochMilli());
    assertThat(metadata.getLong(EmbeddingMetadata.VALID_TO)).isEqualTo(Long.MAX_VALUE);
    assertThat(metadata.getString(EmbeddingMetadata.CATEGORY_ID)).isEqualTo("cat-7");
    assertThat(metadata.getString(EmbeddingMetadata.TAGS)).isEqualTo(",geo,maps,");
    assertThat(metadata.getString(EmbeddingMetadata.SOURCE_TYPE)).isEqualTo("imported");
  }

  @Test
  void missing_category_is_omitted() {
    ContentItem item = new ContentItemBuilder().build();
    ContentVersion version = new ContentVersionBuilder().contentItemId(item.getId()).build();

    Metadata metadata = EmbeddingMetadata.forVersion(item, version);

    assertThat(metadata.containsKey(EmbeddingMetadata.CATEGORY_ID)).isFalse();
  }

  @Test
  void tag_needle_matches_whole_tags_only() {
    String token = EmbeddingMetadata.tagsToken(List.of("geo", "geology"));

    assertThat(token).contains(EmbeddingMetadata.tagNeedle("geo"));
    assertThat(token).doesNotContain(EmbeddingMetadata.tagNeedle("ge"));
    assertThat(EmbeddingMetadata.tagsToken(List.of())).isEqualTo(",");
  }
}
