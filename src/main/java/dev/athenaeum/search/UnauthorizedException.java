package dev.athenaeum.search;

/** The request carries no usable access scope (zero principal claims). */
public class UnauthorizedException extends SearchException {

  public UnauthorizedException(String message) {
    super(message);
  }
}
