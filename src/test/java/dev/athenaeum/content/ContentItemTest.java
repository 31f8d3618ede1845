package dev.athenaeum.content;

import static org.assertj.core.api.Assertions.assertThat;

import dev.athenaeum.fixture.ContentItemBuilder;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContentItemTest {

  @Test
  void requiredRolesAndTagsRoundTripThroughCommaSeparatedColumns() {
    ContentItem item =
        new ContentItemBuilder().requiredRoles("editor", " admin ").tags("geo", "science").build();

    assertThat(item.getRequiredRoles()).isEqualTo("editor,admin");
    assertThat(item.getRequiredRoleSet()).containsExactly("editor", "admin");
    assertThat(item.getTagList()).containsExactly("geo", "science");
  }

  @Test
  void noRolesMeansEmptySet() {
    ContentItem item = new ContentItemBuilder().build();

    assertThat(item.getRequiredRoles()).isNull();
    assertThat(item.getRequiredRoleSet()).isEmpty();
    assertThat(item.getTagList()).isEmpty();
  }

  @Test
  void joinDropsBlanksAndDuplicates() {
    assertThat(ContentItem.joinCommaSeparated(List.of("a", " ", "b", "a"))).isEqualTo("a,b");
    assertThat(ContentItem.joinCommaSeparated(Arrays.asList(" ", ""))).isNull();
    assertThat(ContentItem.joinCommaSeparated(null)).isNull();
  }
}
