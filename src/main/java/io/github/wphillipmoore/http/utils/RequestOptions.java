package io.github.wphillipmoore.http.utils;

import java.net.HttpCookie;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Optional settings for a single HTTP call.
 *
 * <p>Instances are immutable and created via the {@link Builder}:
 *
 * <pre>{@code
 * RequestOptions options = RequestOptions.builder()
 *     .header("X-Request-Id", "42")
 *     .token("Bearer abc")
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 *
 * <p>The caller's header map is copied; the helpers never write back into it.
 */
public final class RequestOptions {

  /** Timeout used when none is configured, or when the configured one is not positive. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private static final RequestOptions DEFAULTS = new Builder().build();

  private final Map<String, String> headers;
  private final @Nullable HttpCookie cookie;
  private final @Nullable String token;
  private final @Nullable HttpTransport transport;
  private final @Nullable Duration timeout;

  private RequestOptions(Builder builder) {
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.cookie = builder.cookie;
    this.token = builder.token;
    this.transport = builder.transport;
    this.timeout = builder.timeout;
  }

  /** Returns options with every setting left at its default. */
  public static RequestOptions defaults() {
    return DEFAULTS;
  }

  /** Returns a new, empty builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder pre-populated with this instance's settings. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.headers.putAll(headers);
    builder.cookie = cookie;
    builder.token = token;
    builder.transport = transport;
    builder.timeout = timeout;
    return builder;
  }

  /** Returns the caller-supplied headers. The returned map is unmodifiable. */
  public Map<String, String> headers() {
    return headers;
  }

  /** Returns the cookie to send, or {@code null}. */
  public @Nullable HttpCookie cookie() {
    return cookie;
  }

  /** Returns the {@code Authorization} value to send verbatim, or {@code null}. */
  public @Nullable String token() {
    return token;
  }

  /** Returns the caller-supplied transport, or {@code null} to use a per-call default. */
  public @Nullable HttpTransport transport() {
    return transport;
  }

  /** Returns the configured timeout, or {@code null}. */
  public @Nullable Duration timeout() {
    return timeout;
  }

  /**
   * Returns the timeout to apply: the configured value if positive, otherwise {@link
   * #DEFAULT_TIMEOUT}.
   *
   * @return the effective timeout, never null
   */
  public Duration effectiveTimeout() {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return DEFAULT_TIMEOUT;
    }
    return timeout;
  }

  @Override
  public String toString() {
    return "RequestOptions[headers="
        + headers.keySet()
        + ", cookie="
        + (cookie != null ? cookie.getName() : null)
        + ", token="
        + (token != null ? "***" : null)
        + ", transport="
        + transport
        + ", timeout="
        + timeout
        + "]";
  }

  /** Builder for {@link RequestOptions}. */
  public static final class Builder {

    private final Map<String, String> headers = new LinkedHashMap<>();
    private @Nullable HttpCookie cookie;
    private @Nullable String token;
    private @Nullable HttpTransport transport;
    private @Nullable Duration timeout;

    private Builder() {}

    /** Replaces all headers with a copy of the given map. {@code null} clears them. */
    public Builder headers(@Nullable Map<String, String> headers) {
      this.headers.clear();
      if (headers != null) {
        headers.forEach(this::header);
      }
      return this;
    }

    /**
     * Adds or replaces a single header. {@code Connection}, {@code Content-Length}, {@code Expect},
     * {@code Host} and {@code Upgrade} are managed by the JDK HTTP client and are not sent.
     */
    public Builder header(String name, String value) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
      this.headers.put(name, value);
      return this;
    }

    /** Sets the cookie to attach to the request. */
    public Builder cookie(@Nullable HttpCookie cookie) {
      this.cookie = cookie;
      return this;
    }

    /**
     * Sets the {@code Authorization} value. It is sent verbatim, so include any scheme prefix such
     * as {@code "Bearer "}. {@code null} or empty omits the header.
     */
    public Builder token(@Nullable String token) {
      this.token = token;
      return this;
    }

    /** Sets a custom transport. Defaults to a new {@link HttpClientTransport} per call. */
    public Builder transport(@Nullable HttpTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Sets the request timeout. {@code null}, zero or negative selects 30 seconds. */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Builds the immutable options. */
    public RequestOptions build() {
      return new RequestOptions(this);
    }
  }
}
