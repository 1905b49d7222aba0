package io.github.wphillipmoore.http.utils;

import io.github.wphillipmoore.http.utils.exception.ResourceException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import javax.net.ssl.SSLContext;

/**
 * JDK {@link HttpClient}-based implementation of {@link HttpTransport}.
 *
 * <p>Redirects are followed, except from HTTPS to HTTP. The response body is read in full before
 * {@link #send} returns.
 */
public final class HttpClientTransport implements HttpTransport {

  private static final String REQUEST_FAILED = "HTTP request failed";

  private final HttpClient client;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.client = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
  }

  /**
   * Creates a transport whose client gives up connecting after {@code connectTimeout}.
   *
   * @param connectTimeout the connect timeout
   */
  public HttpClientTransport(Duration connectTimeout) {
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.client =
        HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  /**
   * Creates a transport with a custom {@link SSLContext}, e.g. for mutual TLS or a private trust
   * store.
   *
   * @param sslContext the SSL context to use
   */
  public HttpClientTransport(SSLContext sslContext) {
    Objects.requireNonNull(sslContext, "sslContext");
    this.client =
        HttpClient.newBuilder()
            .sslContext(sslContext)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
  }

  /**
   * Creates a transport around a caller-configured {@link HttpClient}. Use this to share a client
   * (and its connection pool) across calls, or to configure proxies and authenticators.
   *
   * @param client the HTTP client to use
   */
  public HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  /**
   * {@inheritDoc}
   *
   * <p>The request's own timeout bounds the whole exchange, including reading the body. Without
   * one the call waits for the exchange to finish.
   */
  @Override
  @SuppressWarnings("PMD.CloseResource") // HttpClient is managed by this transport, not disposable
  public TransportResponse send(HttpRequest request) {
    String url = request.uri().toString();
    AtomicInteger statusCode = new AtomicInteger(ResourceException.NO_STATUS);
    HttpResponse.BodyHandler<byte[]> handler =
        responseInfo -> {
          statusCode.set(responseInfo.statusCode());
          return HttpResponse.BodySubscribers.ofByteArray();
        };

    CompletableFuture<HttpResponse<byte[]>> exchange = client.sendAsync(request, handler);
    HttpResponse<byte[]> response;
    try {
      Optional<Duration> timeout = request.timeout();
      response =
          timeout.isPresent()
              ? exchange.get(timeout.get().toNanos(), TimeUnit.NANOSECONDS)
              : exchange.get();
    } catch (TimeoutException e) {
      exchange.cancel(true);
      HttpTimeoutException timedOut = new HttpTimeoutException("request timed out");
      timedOut.initCause(e);
      throw new ResourceException(REQUEST_FAILED, url, timedOut);
    } catch (InterruptedException e) {
      exchange.cancel(true);
      Thread.currentThread().interrupt();
      throw new ResourceException("HTTP request interrupted", url, e);
    } catch (ExecutionException e) {
      throw failure(url, statusCode.get(), e.getCause() != null ? e.getCause() : e);
    }

    return new TransportResponse(
        response.statusCode(), response.body(), flattenHeaders(response.headers()));
  }

  /** Maps a failed exchange; once the status line has arrived the failure was in the body. */
  private static ResourceException failure(String url, int statusCode, Throwable cause) {
    if (statusCode != ResourceException.NO_STATUS) {
      return new ResourceException("Failed to read response body", url, statusCode, null, cause);
    }
    return new ResourceException(REQUEST_FAILED, url, cause);
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }
}
