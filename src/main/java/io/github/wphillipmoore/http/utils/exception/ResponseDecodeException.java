package io.github.wphillipmoore.http.utils.exception;

import java.util.Objects;

/**
 * Thrown (or reported through {@code HttpResult#error()}) when a successful response body cannot be
 * decoded into the requested type.
 *
 * <p>The cause is the codec's own failure, unchanged. Unlike {@link ResourceException}, the
 * exchange itself succeeded and the reported status code is the server's.
 */
public final class ResponseDecodeException extends HttpUtilsException {

  private static final long serialVersionUID = 1L;

  private final String format;

  /**
   * Creates a decode exception.
   *
   * @param message description of the failure
   * @param format the body format that failed to decode (e.g. "JSON")
   * @param cause the codec failure
   */
  public ResponseDecodeException(String message, String format, Throwable cause) {
    super(message, Objects.requireNonNull(cause, "cause"));
    this.format = Objects.requireNonNull(format, "format");
  }

  /** Returns the body format that failed to decode. */
  public String getFormat() {
    return format;
  }
}
