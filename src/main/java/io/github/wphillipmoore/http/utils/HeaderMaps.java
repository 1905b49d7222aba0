package io.github.wphillipmoore.http.utils;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Builds effective header maps without touching the caller's map. Header names are compared
 * case-insensitively.
 */
final class HeaderMaps {

  static final String CONTENT_TYPE = "Content-Type";
  static final String AUTHORIZATION = "Authorization";

  private HeaderMaps() {}

  /**
   * Returns a copy of {@code headers} with {@code name} set to {@code value}.
   *
   * @param headers the source headers, or {@code null}
   * @param name the header name
   * @param value the header value
   * @param overwrite whether to replace an existing value; if {@code false} an existing value wins
   * @return a new mutable map
   */
  static Map<String, String> with(
      @Nullable Map<String, String> headers, String name, String value, boolean overwrite) {
    Map<String, String> result =
        headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>();
    if (!overwrite && containsIgnoreCase(result, name)) {
      return result;
    }
    result.keySet().removeIf(key -> key.equalsIgnoreCase(name));
    result.put(name, value);
    return result;
  }

  static boolean containsIgnoreCase(Map<String, String> headers, String name) {
    for (String key : headers.keySet()) {
      if (key.equalsIgnoreCase(name)) {
        return true;
      }
    }
    return false;
  }
}
