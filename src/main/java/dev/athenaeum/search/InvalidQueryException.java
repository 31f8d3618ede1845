package dev.athenaeum.search;

/** The query text or page bounds are unusable. Client error; retrying will not help. */
public class InvalidQueryException extends SearchException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
