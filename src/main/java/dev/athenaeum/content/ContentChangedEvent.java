package dev.athenaeum.content;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Published whenever a content item gains a version, loses its current version, or has its
 * visibility metadata changed. Listeners use it to drop derived state (cached result sets) that
 * references the item.
 *
 * @param contentItemId the affected item
 * @param changeType what happened
 * @param occurredAt when the change took effect
 */
public record ContentChangedEvent(UUID contentItemId, ChangeType changeType, Instant occurredAt) {

  public ContentChangedEvent {
    Objects.requireNonNull(contentItemId, "contentItemId");
    Objects.requireNonNull(changeType, "changeType");
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  /** Kind of change carried by a {@link ContentChangedEvent}. */
  public enum ChangeType {
    /** First version of a new item. */
    CREATED,
    /** A new version superseded the current one. */
    SUPERSEDED,
    /** The current version was closed without a successor. */
    RETIRED,
    /** Tenant path or required roles changed; versions are untouched. */
    ACCESS_CHANGED
  }
}
