package io.github.wphillipmoore.http.utils.exception;

/**
 * Base exception for all HTTP helper errors.
 *
 * <p>This is an unchecked exception hierarchy. Network and status failures are reported as {@link
 * ResourceException}; malformed response bodies are reported as {@link ResponseDecodeException}.
 */
public sealed class HttpUtilsException extends RuntimeException
    permits ResourceException, ResponseDecodeException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message and cause. */
  public HttpUtilsException(String message, Throwable cause) {
    super(message, cause);
  }
}
