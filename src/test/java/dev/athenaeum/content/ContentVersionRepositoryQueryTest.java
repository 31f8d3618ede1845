package dev.athenaeum.content;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Method;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.data.jpa.repository.Query;

class ContentVersionRepositoryQueryTest {

  private static String fullTextSearchSql() throws NoSuchMethodException {
    Method method =
        ContentVersionRepository.class.getMethod(
            "fullTextSearch",
            String.class,
            String.class,
            String.class,
            String.class,
            Instant.class,
            int.class);
    return method.getAnnotation(Query.class).value();
  }

  @Test
  void tagFilterMatchesWholeTagElements() throws Exception {
    String sql = fullTextSearchSql();

    assertThat(sql).contains("string_to_array(i.tags, ',') @> ARRAY[CAST(:tag AS text)]");
    assertThat(sql).doesNotContainIgnoringCase(" LIKE ");
  }

  @Test
  void semanticTagNeedleTreatsWildcardCharactersLiterally() {
    String token = EmbeddingMetadata.tagsToken(List.of("abc", "x%y"));

    assertThat(token).doesNotContain(EmbeddingMetadata.tagNeedle("a_c"));
    assertThat(token).contains(EmbeddingMetadata.tagNeedle("x%y"));
  }
}
