package io.github.wphillipmoore.http.utils;

import java.net.http.HttpRequest;

/**
 * Transport interface that performs a single HTTP exchange.
 *
 * <p>Callers may supply their own implementation through {@link RequestOptions.Builder#transport}
 * to control TLS, proxies or connection pooling. Implementations should throw {@link
 * io.github.wphillipmoore.http.utils.exception.ResourceException} for network, connection or body
 * read failures, and must release the response body before returning.
 */
public interface HttpTransport {

  /**
   * Sends the request and reads the full response body.
   *
   * @param request the fully built request, including its timeout
   * @return the transport response
   */
  TransportResponse send(HttpRequest request);
}
