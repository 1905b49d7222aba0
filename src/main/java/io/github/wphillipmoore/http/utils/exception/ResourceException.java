package io.github.wphillipmoore.http.utils.exception;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown (or reported through {@code HttpResult#error()}) when an outbound call fails.
 *
 * <p>Covers request construction failures, transport failures, body read failures and responses
 * with a status code of 400 or above. The {@code statusCode} is {@code 0} when the request never
 * completed. The {@code body} is the outgoing request body echoed back for diagnostics, or {@code
 * null} if it was not recorded.
 */
public final class ResourceException extends HttpUtilsException {

  private static final long serialVersionUID = 1L;

  /** Status code reported when no response was received. */
  public static final int NO_STATUS = 0;

  private final String url;
  private final int statusCode;
  private final @Nullable String body;

  /**
   * Creates a resource exception for a call that produced no response.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public ResourceException(String message, String url, Throwable cause) {
    this(message, url, NO_STATUS, null, cause);
  }

  /**
   * Creates a resource exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param statusCode the HTTP status code, or {@link #NO_STATUS}
   * @param body the echoed request body, or {@code null}
   * @param cause the underlying cause
   */
  public ResourceException(
      String message, String url, int statusCode, @Nullable String body, Throwable cause) {
    super(message, Objects.requireNonNull(cause, "cause"));
    this.url = Objects.requireNonNull(url, "url");
    this.statusCode = statusCode;
    this.body = body;
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }

  /**
   * Returns the HTTP status code, or {@link #NO_STATUS} if the request never completed.
   *
   * @return the status code
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Returns the echoed request body, or {@code null} if it was not recorded.
   *
   * @return the request body text, or {@code null}
   */
  public @Nullable String getBody() {
    return body;
  }

  @Override
  public String toString() {
    return String.format(
        "Resource error: URL: %s, status code: %d, message: %s, err: %s, body: %s",
        url, statusCode, getMessage(), getCause(), body);
  }
}
