package dev.athenaeum.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A point-in-time snapshot of a {@link ContentItem}'s text, valid over the half-open interval
 * {@code [validFrom, validTo)}.
 *
 * <p>The current version of an item has {@code validTo == null}; a retired item has none. The
 * snapshot's embedding is stored in the embedding store under the version's id, so a version id
 * is enough to reproduce what a query saw at a given as-of time.
 *
 * <p>Maps to the {@code content_versions} table managed by Flyway migrations. The table also holds
 * a generated {@code search_vector} column (full-text index) that is not mapped here.
 */
@Entity
@Table(name = "content_versions")
public class ContentVersion {

  @Id private UUID id;

  @Column(name = "content_item_id", nullable = false, updatable = false)
  private UUID contentItemId;

  @Column(name = "version_number", nullable = false, updatable = false)
  private int versionNumber;

  @Column(nullable = false, updatable = false)
  private String title;

  @Column(columnDefinition = "TEXT", updatable = false)
  private @Nullable String summary;

  @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
  private String text;

  @Column(name = "content_hash", nullable = false, updatable = false)
  private String contentHash;

  @Column(name = "valid_from", nullable = false, updatable = false)
  private Instant validFrom;

  @Column(name = "valid_to")
  private @Nullable Instant validTo;

  @Column(name = "created_by", updatable = false)
  private @Nullable String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ContentVersion() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a new open-ended (current) version.
   *
   * @param id version identifier, also used as the embedding id of the snapshot vector
   * @param contentItemId the owning item
   * @param versionNumber 1-based, increasing per item
   * @param title snapshot title
   * @param summary optional snapshot summary
   * @param text snapshot text
   * @param contentHash hash of the snapshot text
   * @param validFrom start of validity (inclusive)
   */
  public ContentVersion(
      UUID id,
      UUID contentItemId,
      int versionNumber,
      String title,
      @Nullable String summary,
      String text,
      String contentHash,
      Instant validFrom) {
    this.id = id;
    this.contentItemId = contentItemId;
    this.versionNumber = versionNumber;
    this.title = title;
    this.summary = summary;
    this.text = text;
    this.contentHash = contentHash;
    this.validFrom = validFrom;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  /**
   * Whether the instant falls inside {@code [validFrom, validTo)}.
   *
   * @param instant the as-of instant
   * @return true if this version is the valid one at {@code instant}
   */
  public boolean isValidAt(Instant instant) {
    return !instant.isBefore(validFrom) && (validTo == null || instant.isBefore(validTo));
  }

  /** Whether this is the open-ended version of its item. */
  public boolean isCurrent() {
    return validTo == null;
  }

  /**
   * Ends this version's validity. Closing at {@code validFrom} leaves an empty interval, which is
   * allowed; closing before it is not.
   *
   * @param at end of validity (exclusive)
   * @throws IllegalStateException if the version is already closed or {@code at} precedes {@code
   *     validFrom}
   */
  public void close(Instant at) {
    if (validTo != null) {
      throw new IllegalStateException("Version " + id + " already closed at " + validTo);
    }
    if (at.isBefore(validFrom)) {
      throw new IllegalStateException(
          "Cannot close version " + id + " at " + at + ", before its start " + validFrom);
    }
    this.validTo = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getContentItemId() {
    return contentItemId;
  }

  public int getVersionNumber() {
    return versionNumber;
  }

  public String getTitle() {
    return title;
  }

  public @Nullable String getSummary() {
    return summary;
  }

  public String getText() {
    return text;
  }

  public String getContentHash() {
    return contentHash;
  }

  public Instant getValidFrom() {
    return validFrom;
  }

  public @Nullable Instant getValidTo() {
    return validTo;
  }

  public @Nullable String getCreatedBy() {
    return createdBy;
  }

  public void setCreatedBy(@Nullable String createdBy) {
    this.createdBy = createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ContentVersion other)) {
      return false;
    }
    return Objects.equals(id, other.id);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id);
  }

  @Override
  public String toString() {
    return "ContentVersion[id=%s, item=%s, v%d, %s -> %s]"
        .formatted(id, contentItemId, versionNumber, validFrom, validTo);
  }
}
