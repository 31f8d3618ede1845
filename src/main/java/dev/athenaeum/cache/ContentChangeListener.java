package dev.athenaeum.cache;

import dev.athenaeum.content.ContentChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Drops cached pages that reference a content item once the change to that item has committed.
 * Runs immediately when no transaction is active.
 */
@Component
public class ContentChangeListener {

  private static final Logger log = LoggerFactory.getLogger(ContentChangeListener.class);

  private final SearchResultCache cache;

  public ContentChangeListener(SearchResultCache cache) {
    this.cache = cache;
  }

  @TransactionalEventListener(fallbackExecution = true)
  public void onContentChanged(ContentChangedEvent event) {
    int dropped = cache.invalidate(event.contentItemId());
    log.debug(
        "Content item {} {}: dropped {} cached page(s)",
        event.contentItemId(),
        event.changeType(),
        dropped);
  }
}
