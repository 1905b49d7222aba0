package io.github.wphillipmoore.http.utils;

import io.github.wphillipmoore.http.utils.exception.HttpUtilsException;
import io.github.wphillipmoore.http.utils.exception.ResourceException;
import io.github.wphillipmoore.http.utils.exception.ResponseDecodeException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a single call made through {@link HttpUtils}.
 *
 * <p>A result always carries the status code and raw body that were received, even when {@link
 * #error()} is set. Check both together:
 *
 * <ul>
 *   <li>{@link ResourceException} with status {@code 0}: the request never completed.
 *   <li>{@link ResourceException} with a status of 400 or above: the server rejected the request;
 *       {@link #body()} holds the server's response.
 *   <li>{@link ResponseDecodeException}: the exchange succeeded but the body could not be decoded.
 * </ul>
 *
 * @param statusCode the HTTP status code, or {@code 0} if no response was received
 * @param body the raw response body, never null
 * @param value the decoded body, or {@code null} if decoding was not requested or did not succeed
 * @param error the failure, or {@code null} on success
 * @param requestHeaders the effective headers that were sent, never null, unmodifiable
 * @param <T> the decoded body type
 */
public record HttpResult<T>(
    int statusCode,
    byte[] body,
    @Nullable T value,
    @Nullable HttpUtilsException error,
    Map<String, String> requestHeaders) {

  private static final byte[] EMPTY = new byte[0];

  /** Validates non-null fields and defensively copies body and headers. */
  public HttpResult {
    body = Objects.requireNonNull(body, "body").clone();
    requestHeaders = Map.copyOf(Objects.requireNonNull(requestHeaders, "requestHeaders"));
  }

  static <T> HttpResult<T> failure(ResourceException error, Map<String, String> requestHeaders) {
    return new HttpResult<>(error.getStatusCode(), EMPTY, null, error, requestHeaders);
  }

  /** Returns a copy of the response body. */
  @Override
  public byte[] body() {
    return body.clone();
  }

  /** Returns the response body decoded as UTF-8. */
  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /** Returns {@code true} when no error was recorded. */
  public boolean isSuccess() {
    return error == null;
  }

  /**
   * Returns the decoded value, throwing the recorded error if there is one.
   *
   * @return the decoded value, or {@code null} if decoding was not requested or the body was empty
   * @throws HttpUtilsException the recorded error
   */
  public @Nullable T orThrow() {
    if (error != null) {
      throw error;
    }
    return value;
  }

  HttpResult<T> withValue(@Nullable T decoded) {
    return new HttpResult<>(statusCode, body, decoded, error, requestHeaders);
  }

  HttpResult<T> withError(HttpUtilsException failure) {
    return new HttpResult<>(statusCode, body, value, failure, requestHeaders);
  }

  @Override
  public String toString() {
    return "HttpResult[statusCode="
        + statusCode
        + ", bodyLength="
        + body.length
        + ", value="
        + value
        + ", error="
        + error
        + "]";
  }
}
