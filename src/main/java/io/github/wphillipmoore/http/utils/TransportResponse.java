package io.github.wphillipmoore.http.utils;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable response from an {@link HttpTransport} exchange.
 *
 * <p>The body and headers are defensively copied to guarantee immutability.
 *
 * @param statusCode the HTTP status code
 * @param body the raw response body, never null (empty if no body)
 * @param headers the response headers, never null, unmodifiable
 */
public record TransportResponse(int statusCode, byte[] body, Map<String, String> headers) {

  /** Validates non-null fields and defensively copies body and headers. */
  public TransportResponse {
    body = Objects.requireNonNull(body, "body").clone();
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
  }

  /** Returns a copy of the response body. */
  @Override
  public byte[] body() {
    return body.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof TransportResponse response)) {
      return false;
    }
    return statusCode == response.statusCode
        && Arrays.equals(body, response.body)
        && headers.equals(response.headers);
  }

  @Override
  public int hashCode() {
    return Objects.hash(statusCode, Arrays.hashCode(body), headers);
  }

  @Override
  public String toString() {
    return "TransportResponse[statusCode="
        + statusCode
        + ", bodyLength="
        + body.length
        + ", headers="
        + headers
        + "]";
  }
}
