package io.github.wphillipmoore.http.utils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites a URL's query string into canonical form.
 *
 * <p>Parameters are sorted by the bytes of their key, values keep their relative order, and every
 * key and value is re-escaped so that only {@code A-Z a-z 0-9 - _ . ~} remain literal and spaces
 * become {@code +}. Decoded bytes are carried as-is, never through a charset. Pairs that cannot be
 * decoded, or that contain {@code ;}, are dropped.
 */
final class QueryNormalizer {

  private static final HexFormat HEX = HexFormat.of().withUpperCase();

  private QueryNormalizer() {}

  /**
   * Returns {@code url} with its query re-encoded, or {@code url} unchanged if it has no query.
   *
   * @param url the URL to normalize
   * @return the normalized URL
   * @throws IllegalArgumentException if the URL contains control characters
   */
  static String normalize(String url) {
    for (int i = 0; i < url.length(); i++) {
      char c = url.charAt(i);
      if (c < 0x20 || c == 0x7f) {
        throw new IllegalArgumentException("invalid control character in URL");
      }
    }

    int queryStart = url.indexOf('?');
    if (queryStart < 0) {
      return url;
    }
    int fragmentStart = url.indexOf('#');
    if (fragmentStart >= 0 && fragmentStart < queryStart) {
      return url;
    }

    String base = url.substring(0, queryStart);
    String query;
    String fragment;
    if (fragmentStart < 0) {
      query = url.substring(queryStart + 1);
      fragment = "";
    } else {
      query = url.substring(queryStart + 1, fragmentStart);
      fragment = url.substring(fragmentStart);
    }

    String encoded = encode(parse(query));
    return encoded.isEmpty() ? base + fragment : base + "?" + encoded + fragment;
  }

  /**
   * Splits and decodes a raw query string, keyed in byte order.
   *
   * <p>Keys and values are byte strings: each {@code char} holds one decoded byte, so escapes that
   * are not valid UTF-8 survive unchanged.
   */
  static Map<String, List<String>> parse(String query) {
    Map<String, List<String>> params = new TreeMap<>();
    for (String pair : query.split("&", -1)) {
      if (pair.isEmpty() || pair.indexOf(';') >= 0) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = unescape(eq < 0 ? pair : pair.substring(0, eq));
      String value = unescape(eq < 0 ? "" : pair.substring(eq + 1));
      if (key == null || value == null) {
        continue;
      }
      params.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }
    return params;
  }

  static String encode(Map<String, List<String>> params) {
    StringJoiner joiner = new StringJoiner("&");
    params.forEach(
        (key, values) -> {
          String escapedKey = escape(key.getBytes(StandardCharsets.ISO_8859_1));
          for (String value : values) {
            joiner.add(escapedKey + "=" + escape(value.getBytes(StandardCharsets.ISO_8859_1)));
          }
        });
    return joiner.toString();
  }

  /** Decodes {@code +} and percent escapes into a byte string, or {@code null} on a bad escape. */
  static @Nullable String unescape(String raw) {
    byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
    ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
    for (int i = 0; i < bytes.length; i++) {
      byte b = bytes[i];
      if (b == '+') {
        out.write(' ');
      } else if (b == '%') {
        if (i + 2 >= bytes.length
            || !HexFormat.isHexDigit(bytes[i + 1])
            || !HexFormat.isHexDigit(bytes[i + 2])) {
          return null;
        }
        out.write(HexFormat.fromHexDigit(bytes[i + 1]) << 4 | HexFormat.fromHexDigit(bytes[i + 2]));
        i += 2;
      } else {
        out.write(b);
      }
    }
    return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
  }

  /** Escapes raw bytes, keeping only {@code A-Z a-z 0-9 - _ . ~} literal and writing space as +. */
  static String escape(byte[] raw) {
    StringBuilder sb = new StringBuilder(raw.length);
    for (byte b : raw) {
      if (isUnreserved(b)) {
        sb.append((char) b);
      } else if (b == ' ') {
        sb.append('+');
      } else {
        sb.append('%').append(HEX.toHexDigits(b));
      }
    }
    return sb.toString();
  }

  private static boolean isUnreserved(byte b) {
    return (b >= 'A' && b <= 'Z')
        || (b >= 'a' && b <= 'z')
        || (b >= '0' && b <= '9')
        || b == '-'
        || b == '_'
        || b == '.'
        || b == '~';
  }
}
