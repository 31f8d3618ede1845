package dev.athenaeum.search;

import java.time.Instant;
import java.util.UUID;

/**
 * No version of a content item is valid at the requested instant. The orchestrator drops the
 * candidate and keeps going.
 */
public class NoValidVersionException extends SearchException {

  private final UUID contentItemId;
  private final Instant asOf;

  public NoValidVersionException(UUID contentItemId, Instant asOf) {
    super("No version of content item " + contentItemId + " is valid at " + asOf);
    this.contentItemId = contentItemId;
    this.asOf = asOf;
  }

  public UUID getContentItemId() {
    return contentItemId;
  }

  public Instant getAsOf() {
    return asOf;
  }
}
