package dev.athenaeum.search;

/**
 * No upstream could serve the request: both retrieval branches failed, or the content store could
 * not be read after fusion.
 */
public class UpstreamUnavailableException extends SearchException {

  public UpstreamUnavailableException(String message) {
    super(message);
  }

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
