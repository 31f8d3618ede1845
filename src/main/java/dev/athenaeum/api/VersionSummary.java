package dev.athenaeum.api;

import dev.athenaeum.content.ContentVersion;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** One entry of an item's revision history, without the version text. */
public record VersionSummary(
    UUID versionId,
    int versionNumber,
    String title,
    @Nullable String summary,
    String contentHash,
    Instant validFrom,
    @Nullable Instant validTo,
    @Nullable String createdBy) {

  static VersionSummary from(ContentVersion version) {
    return new VersionSummary(
        version.getId(),
        version.getVersionNumber(),
        version.getTitle(),
        version.getSummary(),
        version.getContentHash(),
        version.getValidFrom(),
        version.getValidTo(),
        version.getCreatedBy());
  }
}
