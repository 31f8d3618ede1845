package dev.athenaeum.content;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ContentItem} entities. */
public interface ContentItemRepository extends JpaRepository<ContentItem, UUID> {

  /**
   * Finds the oldest item whose latest snapshot has the given hash. Several items may hold the
   * same text when drafts name their item explicitly.
   *
   * @param contentHash SHA-256 hex of the snapshot document
   * @return the matching item, or empty if no item holds this text
   */
  Optional<ContentItem> findFirstByContentHashOrderByCreatedAtAsc(String contentHash);
}
