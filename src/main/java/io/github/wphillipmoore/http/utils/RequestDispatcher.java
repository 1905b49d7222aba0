package io.github.wphillipmoore.http.utils;

import io.github.wphillipmoore.http.utils.exception.ResourceException;
import java.net.HttpCookie;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and executes the outbound request shared by every {@link HttpUtils} entry point.
 *
 * <p>Never throws for request, network or status failures; they are reported through {@link
 * HttpResult#error()}.
 */
final class RequestDispatcher {

  static final String STATUS_ERROR_MESSAGE = "incorrect response status code";

  private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

  /** Header names the JDK client refuses unless {@code jdk.httpclient.allowRestrictedHeaders}. */
  static final Set<String> RESTRICTED_HEADERS = restrictedHeaders();

  private RequestDispatcher() {}

  /**
   * Sends one request.
   *
   * @param method the HTTP method, already normalized
   * @param url the target URL; its query is re-encoded before sending
   * @param body the request body, empty for none
   * @param headers the headers to send, including the content type
   * @param options cookie, token, transport and timeout settings
   * @param <T> the decoded type of the eventual result
   * @return the status, body and error of the exchange; never decoded
   */
  static <T> HttpResult<T> dispatch(
      String method,
      String url,
      byte[] body,
      Map<String, String> headers,
      RequestOptions options) {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(headers, "headers");
    Objects.requireNonNull(options, "options");

    Duration timeout = options.effectiveTimeout();
    Map<String, String> effectiveHeaders = headers;
    String token = options.token();
    if (token != null && !token.isEmpty()) {
      effectiveHeaders = HeaderMaps.with(headers, HeaderMaps.AUTHORIZATION, token, true);
    }

    HttpRequest request;
    String target;
    try {
      target = QueryNormalizer.normalize(url);
      request = buildRequest(method, target, body, effectiveHeaders, options.cookie(), timeout);
    } catch (IllegalArgumentException e) {
      log.debug("Could not build {} request for {}: {}", method, url, e.getMessage());
      return HttpResult.failure(
          new ResourceException("Failed to build request", url, e), effectiveHeaders);
    }

    HttpTransport transport = options.transport();
    if (transport == null) {
      transport = new HttpClientTransport(timeout);
    }

    log.debug("Dispatching {} {} (timeout {})", method, target, timeout);
    TransportResponse response;
    try {
      response = transport.send(request);
    } catch (ResourceException e) {
      log.debug(
          "{} {} failed with status {}: {}", method, target, e.getStatusCode(), e.getMessage());
      return HttpResult.failure(e, effectiveHeaders);
    }

    int statusCode = response.statusCode();
    if (statusCode > 399) {
      log.debug("{} {} returned status {}", method, target, statusCode);
      ResourceException error =
          new ResourceException(
              STATUS_ERROR_MESSAGE,
              target,
              statusCode,
              new String(body, StandardCharsets.UTF_8),
              new IllegalStateException("incorrect status code"));
      return new HttpResult<>(statusCode, response.body(), null, error, effectiveHeaders);
    }

    return new HttpResult<>(statusCode, response.body(), null, null, effectiveHeaders);
  }

  /**
   * Builds the JDK request.
   *
   * <p>Headers the JDK client manages itself ({@link #RESTRICTED_HEADERS}) are skipped.
   *
   * @throws IllegalArgumentException if the URL, method or a header is not acceptable
   */
  static HttpRequest buildRequest(
      String method,
      String url,
      byte[] body,
      Map<String, String> headers,
      @Nullable HttpCookie cookie,
      Duration timeout) {
    HttpRequest.BodyPublisher publisher =
        body.length == 0
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(body);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).method(method, publisher);

    if (cookie != null) {
      builder.header("Cookie", cookie.getName() + "=" + cookie.getValue());
    }
    headers.forEach(
        (name, value) -> {
          if (isRestricted(name)) {
            log.debug("Skipping header {}: the JDK HTTP client sets it itself", name);
          } else {
            builder.header(name, value);
          }
        });

    return builder.build();
  }

  static boolean isRestricted(String name) {
    return RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT));
  }

  private static Set<String> restrictedHeaders() {
    Set<String> restricted =
        new HashSet<>(Set.of("connection", "content-length", "expect", "host", "upgrade"));
    String allowed = System.getProperty("jdk.httpclient.allowRestrictedHeaders", "");
    for (String name : allowed.split(",")) {
      restricted.remove(name.trim().toLowerCase(Locale.ROOT));
    }
    return Set.copyOf(restricted);
  }
}
