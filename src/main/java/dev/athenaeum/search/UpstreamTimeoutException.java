package dev.athenaeum.search;

import java.time.Duration;

/** The request deadline elapsed before fusion could complete. Nothing is cached. */
public class UpstreamTimeoutException extends SearchException {

  private final Duration deadline;

  public UpstreamTimeoutException(Duration deadline) {
    super("Search did not complete within " + deadline.toMillis() + " ms");
    this.deadline = deadline;
  }

  public Duration getDeadline() {
    return deadline;
  }
}
