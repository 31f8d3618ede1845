package dev.athenaeum.content;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A knowledge entry whose text is served through versioned snapshots ({@link ContentVersion}).
 *
 * <p>The item carries the visibility scope used by access filtering: an optional tenant path
 * ({@code null} means platform-wide) and an optional set of required roles (empty means any role).
 * Category, tags and source type mirror the knowledge-base metadata and are also denormalised into
 * the embedding metadata at indexing time so that both search branches can filter on them.
 *
 * <p>{@code contentHash} is the hash of the current snapshot text and is unique: indexing text
 * that already exists never creates a second vector entry.
 *
 * <p>Maps to the {@code content_items} table managed by Flyway migrations.
 *
 * @see ContentVersion
 * @see ContentItemRepository
 */
@Entity
@Table(name = "content_items")
public class ContentItem {

  @Id private UUID id;

  @Column(nullable = false)
  private String title;

  @Column(name = "content_hash", nullable = false)
  private String contentHash;

  @Column(name = "owner_id")
  private @Nullable String ownerId;

  @Column(name = "tenant_path")
  private @Nullable String tenantPath;

  @Column(name = "required_roles")
  private @Nullable String requiredRoles;

  @Column(name = "category_id")
  private @Nullable String categoryId;

  @Column(name = "tags")
  private @Nullable String tags;

  @Column(name = "source_type", nullable = false)
  private String sourceType;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ContentItem() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a new content item. The identifier is assigned by the caller so that the first
   * version and its embedding can reference it before the row is flushed.
   *
   * @param id stable identifier
   * @param title display title of the current version
   * @param contentHash hash of the current snapshot text
   * @param sourceType origin of the entry, e.g. {@code manual} or {@code imported}
   */
  public ContentItem(UUID id, String title, String contentHash, String sourceType) {
    this.id = id;
    this.title = title;
    this.contentHash = contentHash;
    this.sourceType = sourceType;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getContentHash() {
    return contentHash;
  }

  public void setContentHash(String contentHash) {
    this.contentHash = contentHash;
  }

  public @Nullable String getOwnerId() {
    return ownerId;
  }

  public void setOwnerId(@Nullable String ownerId) {
    this.ownerId = ownerId;
  }

  public @Nullable String getTenantPath() {
    return tenantPath;
  }

  public void setTenantPath(@Nullable String tenantPath) {
    this.tenantPath = tenantPath;
  }

  public @Nullable String getRequiredRoles() {
    return requiredRoles;
  }

  public void setRequiredRoles(@Nullable String requiredRoles) {
    this.requiredRoles = requiredRoles;
  }

  public @Nullable String getCategoryId() {
    return categoryId;
  }

  public void setCategoryId(@Nullable String categoryId) {
    this.categoryId = categoryId;
  }

  public @Nullable String getTags() {
    return tags;
  }

  public void setTags(@Nullable String tags) {
    this.tags = tags;
  }

  public String getSourceType() {
    return sourceType;
  }

  public void setSourceType(String sourceType) {
    this.sourceType = sourceType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /**
   * Parses the comma-separated required roles.
   *
   * @return the roles a reader must hold at least one of, or an empty set if any role may read
   */
  public Set<String> getRequiredRoleSet() {
    return new LinkedHashSet<>(parseCommaSeparated(requiredRoles));
  }

  /**
   * Parses the comma-separated tags.
   *
   * @return list of tags, or empty list if none assigned
   */
  public List<String> getTagList() {
    return parseCommaSeparated(tags);
  }

  /**
   * Joins values into the comma-separated column format, dropping blanks and duplicates.
   *
   * @param values the values to join
   * @return the joined string, or {@code null} when nothing remains
   */
  public static @Nullable String joinCommaSeparated(@Nullable List<String> values) {
    if (values == null) {
      return null;
    }
    String joined =
        values.stream()
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .distinct()
            .collect(Collectors.joining(","));
    return joined.isEmpty() ? null : joined;
  }

  private static List<String> parseCommaSeparated(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
