package dev.athenaeum.search;

import dev.athenaeum.content.ContentVersion;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Picks the version of a content item whose {@code [valid_from, valid_to)} interval contains a
 * given instant. Pure; the caller loads the versions.
 */
@Component
public class VersionResolver {

  /**
   * Resolves the version valid at {@code asOf}.
   *
   * <p>Intervals of one item never overlap; should they, the latest {@code valid_from} wins so the
   * answer stays deterministic.
   *
   * @param contentItemId the item
   * @param versions the item's versions, any order; versions of other items are ignored
   * @param asOf the instant to resolve at
   * @return the valid version
   * @throws NoValidVersionException if no version is valid at {@code asOf}
   */
  public ContentVersion resolve(
      UUID contentItemId, Collection<ContentVersion> versions, Instant asOf) {
    return versions.stream()
        .filter(v -> contentItemId.equals(v.getContentItemId()))
        .filter(v -> v.isValidAt(asOf))
        .max(Comparator.comparing(ContentVersion::getValidFrom))
        .orElseThrow(() -> new NoValidVersionException(contentItemId, asOf));
  }
}
