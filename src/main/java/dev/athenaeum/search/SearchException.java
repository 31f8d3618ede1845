package dev.athenaeum.search;

/**
 * Root of the query-path failure taxonomy. Upstream transport errors are converted into one of the
 * subclasses at the {@link SearchService} boundary and never reach callers as-is.
 */
public abstract class SearchException extends RuntimeException {

  protected SearchException(String message) {
    super(message);
  }

  protected SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
