package dev.athenaeum.config;

import dev.athenaeum.search.InvalidQueryException;
import dev.athenaeum.search.UnauthorizedException;
import dev.athenaeum.search.UpstreamTimeoutException;
import dev.athenaeum.search.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>{@link InvalidQueryException}, {@link IllegalArgumentException}: 400
 *   <li>{@link UnauthorizedException}: 401
 *   <li>{@link UpstreamUnavailableException}: 503
 *   <li>{@link UpstreamTimeoutException}: 504
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidQueryException.class)
  ProblemDetail handleInvalidQuery(InvalidQueryException ex) {
    return problem(HttpStatus.BAD_REQUEST, "Invalid query", ex.getMessage());
  }

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(UnauthorizedException.class)
  ProblemDetail handleUnauthorized(UnauthorizedException ex) {
    return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage());
  }

  @ExceptionHandler(UpstreamUnavailableException.class)
  ProblemDetail handleUnavailable(UpstreamUnavailableException ex) {
    log.error("Search upstream unavailable: {}", ex.getMessage(), ex);
    return problem(HttpStatus.SERVICE_UNAVAILABLE, "Upstream unavailable", ex.getMessage());
  }

  @ExceptionHandler(UpstreamTimeoutException.class)
  ProblemDetail handleTimeout(UpstreamTimeoutException ex) {
    return problem(HttpStatus.GATEWAY_TIMEOUT, "Upstream timeout", ex.getMessage());
  }

  private static ProblemDetail problem(HttpStatus status, String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    return problem;
  }
}
