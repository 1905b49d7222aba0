package io.github.wphillipmoore.http.utils;

import io.github.wphillipmoore.http.utils.codec.BodyDecoder;
import io.github.wphillipmoore.http.utils.codec.JsonBodyDecoder;
import io.github.wphillipmoore.http.utils.codec.XmlBodyDecoder;
import io.github.wphillipmoore.http.utils.exception.ResponseDecodeException;
import io.github.wphillipmoore.http.utils.multipart.FileItem;
import io.github.wphillipmoore.http.utils.multipart.MultipartBody;
import java.lang.reflect.Type;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Entry points for sending an HTTP request and decoding its response.
 *
 * <p>Each method fixes a request method and content type, sends the request through the shared
 * dispatcher, and, when a {@code resultType} is given and the response body is not empty, decodes
 * the body as JSON or XML:
 *
 * <pre>{@code
 * HttpResult<Status> result = HttpUtils.requestJson(
 *     "GET", "https://api.example.com/status", null, RequestOptions.defaults(), Status.class);
 * if (result.isSuccess()) {
 *   Status status = result.value();
 * }
 * }</pre>
 *
 * <p>None of these methods throw for network, status or decoding failures; see {@link HttpResult}.
 * The content type each variant sets replaces any {@code Content-Type} in the caller's headers,
 * except for {@link #postFormXml}, which keeps a caller-supplied one.
 */
public final class HttpUtils {

  static final String JSON_CONTENT_TYPE = "application/json";
  static final String XML_CONTENT_TYPE = "text/xml";
  static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

  private static final byte[] EMPTY = new byte[0];

  private HttpUtils() {}

  /**
   * Sends a request with a JSON content type and decodes a JSON response.
   *
   * @param method the HTTP method; trimmed and upper-cased
   * @param url the target URL
   * @param body the request body, or {@code null} for none
   * @param options headers, cookie, token, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> requestJson(
      String method,
      String url,
      byte @Nullable [] body,
      RequestOptions options,
      @Nullable Type resultType) {
    return send(
        normalizeMethod(method),
        url,
        body,
        options,
        JSON_CONTENT_TYPE,
        true,
        JsonBodyDecoder.INSTANCE,
        resultType);
  }

  /**
   * Sends a request with a JSON content type and the given {@code Authorization} value, and decodes
   * a JSON response.
   *
   * @param method the HTTP method; trimmed and upper-cased
   * @param url the target URL
   * @param token the {@code Authorization} value, sent verbatim; overrides {@link
   *     RequestOptions#token()}
   * @param body the request body, or {@code null} for none
   * @param options headers, cookie, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> requestJson(
      String method,
      String url,
      @Nullable String token,
      byte @Nullable [] body,
      RequestOptions options,
      @Nullable Type resultType) {
    return requestJson(method, url, body, withToken(options, token), resultType);
  }

  /**
   * Sends a request with an XML content type and decodes an XML response.
   *
   * @param method the HTTP method; trimmed and upper-cased
   * @param url the target URL
   * @param body the request body, or {@code null} for none
   * @param options headers, cookie, token, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> requestXml(
      String method,
      String url,
      byte @Nullable [] body,
      RequestOptions options,
      @Nullable Type resultType) {
    return send(
        normalizeMethod(method),
        url,
        body,
        options,
        XML_CONTENT_TYPE,
        true,
        XmlBodyDecoder.INSTANCE,
        resultType);
  }

  /**
   * Sends a request with an XML content type and the given {@code Authorization} value, and decodes
   * an XML response.
   *
   * @param method the HTTP method; trimmed and upper-cased
   * @param url the target URL
   * @param token the {@code Authorization} value, sent verbatim; overrides {@link
   *     RequestOptions#token()}
   * @param body the request body, or {@code null} for none
   * @param options headers, cookie, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> requestXml(
      String method,
      String url,
      @Nullable String token,
      byte @Nullable [] body,
      RequestOptions options,
      @Nullable Type resultType) {
    return requestXml(method, url, body, withToken(options, token), resultType);
  }

  /**
   * POSTs a form-urlencoded body and decodes a JSON response.
   *
   * @param url the target URL
   * @param body the encoded form, or {@code null} for none
   * @param options headers, cookie, token, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> postForm(
      String url, byte @Nullable [] body, RequestOptions options, @Nullable Type resultType) {
    return send(
        "POST",
        url,
        body,
        options,
        FORM_CONTENT_TYPE,
        true,
        JsonBodyDecoder.INSTANCE,
        resultType);
  }

  /**
   * POSTs a form-urlencoded body and decodes an XML response.
   *
   * <p>Unlike every other variant, the form content type is only applied when the caller's headers
   * do not already carry a {@code Content-Type}.
   *
   * @param url the target URL
   * @param body the encoded form, or {@code null} for none
   * @param options headers, cookie, token, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> postFormXml(
      String url, byte @Nullable [] body, RequestOptions options, @Nullable Type resultType) {
    return send(
        "POST",
        url,
        body,
        options,
        FORM_CONTENT_TYPE,
        false,
        XmlBodyDecoder.INSTANCE,
        resultType);
  }

  /**
   * POSTs a multipart body holding {@code fields} followed by {@code file}, and decodes a JSON
   * response.
   *
   * @param url the target URL
   * @param fields text fields written before the file, or {@code null} for none
   * @param file the file field
   * @param options headers, cookie, token, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> postFile(
      String url,
      @Nullable Map<String, String> fields,
      FileItem file,
      RequestOptions options,
      @Nullable Type resultType) {
    return sendFile("POST", url, fields, file, options, resultType);
  }

  /**
   * Like {@link #postFile(String, Map, FileItem, RequestOptions, Type)}, with the given {@code
   * Authorization} value.
   *
   * @param url the target URL
   * @param token the {@code Authorization} value, sent verbatim; overrides {@link
   *     RequestOptions#token()}
   * @param fields text fields written before the file, or {@code null} for none
   * @param file the file field
   * @param options headers, cookie, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> postFile(
      String url,
      @Nullable String token,
      @Nullable Map<String, String> fields,
      FileItem file,
      RequestOptions options,
      @Nullable Type resultType) {
    return sendFile("POST", url, fields, file, withToken(options, token), resultType);
  }

  /**
   * PUTs a multipart body holding {@code fields} followed by {@code file}, and decodes a JSON
   * response.
   *
   * @param url the target URL
   * @param fields text fields written before the file, or {@code null} for none
   * @param file the file field
   * @param options headers, cookie, token, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> putFile(
      String url,
      @Nullable Map<String, String> fields,
      FileItem file,
      RequestOptions options,
      @Nullable Type resultType) {
    return sendFile("PUT", url, fields, file, options, resultType);
  }

  /**
   * Like {@link #putFile(String, Map, FileItem, RequestOptions, Type)}, with the given {@code
   * Authorization} value.
   *
   * @param url the target URL
   * @param token the {@code Authorization} value, sent verbatim; overrides {@link
   *     RequestOptions#token()}
   * @param fields text fields written before the file, or {@code null} for none
   * @param file the file field
   * @param options headers, cookie, transport and timeout
   * @param resultType the type to decode into, or {@code null} to skip decoding
   * @param <T> the decoded type
   * @return the call result
   */
  public static <T> HttpResult<T> putFile(
      String url,
      @Nullable String token,
      @Nullable Map<String, String> fields,
      FileItem file,
      RequestOptions options,
      @Nullable Type resultType) {
    return sendFile("PUT", url, fields, file, withToken(options, token), resultType);
  }

  private static <T> HttpResult<T> sendFile(
      String method,
      String url,
      @Nullable Map<String, String> fields,
      FileItem file,
      RequestOptions options,
      @Nullable Type resultType) {
    Objects.requireNonNull(file, "file");
    MultipartBody multipart = MultipartBody.of(fields, file);
    return send(
        method,
        url,
        multipart.toByteArray(),
        options,
        multipart.contentType(),
        true,
        JsonBodyDecoder.INSTANCE,
        resultType);
  }

  private static <T> HttpResult<T> send(
      String method,
      String url,
      byte @Nullable [] body,
      RequestOptions options,
      String contentType,
      boolean overwriteContentType,
      BodyDecoder decoder,
      @Nullable Type resultType) {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(options, "options");
    Map<String, String> headers =
        HeaderMaps.with(
            options.headers(), HeaderMaps.CONTENT_TYPE, contentType, overwriteContentType);
    HttpResult<T> result =
        RequestDispatcher.dispatch(method, url, body != null ? body : EMPTY, headers, options);
    return decode(result, decoder, resultType);
  }

  static <T> HttpResult<T> decode(
      HttpResult<T> result, BodyDecoder decoder, @Nullable Type resultType) {
    if (result.error() != null || resultType == null) {
      return result;
    }
    byte[] body = result.body();
    if (body.length == 0) {
      return result;
    }
    try {
      T value = decoder.decode(body, resultType);
      return result.withValue(value);
    } catch (ResponseDecodeException e) {
      return result.withError(e);
    }
  }

  /** Trims and upper-cases {@code method}; a blank method means {@code GET}. */
  static String normalizeMethod(String method) {
    String normalized = Objects.requireNonNull(method, "method").trim().toUpperCase(Locale.ROOT);
    return normalized.isEmpty() ? "GET" : normalized;
  }

  private static RequestOptions withToken(RequestOptions options, @Nullable String token) {
    return Objects.requireNonNull(options, "options").toBuilder().token(token).build();
  }
}
