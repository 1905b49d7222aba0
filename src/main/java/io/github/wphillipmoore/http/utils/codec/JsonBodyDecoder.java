package io.github.wphillipmoore.http.utils.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.Strictness;
import io.github.wphillipmoore.http.utils.exception.ResponseDecodeException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Gson-backed {@link BodyDecoder} for JSON response bodies.
 *
 * <p>The shared instance parses strictly: unquoted names, single quotes, comments and trailing
 * data are rejected. A body holding only whitespace is not a JSON document and fails as well.
 */
public final class JsonBodyDecoder implements BodyDecoder {

  /** Shared instance using a strict {@link Gson}. */
  public static final JsonBodyDecoder INSTANCE =
      new JsonBodyDecoder(new GsonBuilder().setStrictness(Strictness.STRICT).create());

  static final String FORMAT = "JSON";

  private static final String INVALID_JSON = "Invalid JSON in response";

  private final Gson gson;

  /**
   * Creates a decoder backed by the given {@link Gson} instance.
   *
   * @param gson the Gson instance to use
   */
  public JsonBodyDecoder(Gson gson) {
    this.gson = Objects.requireNonNull(gson, "gson");
  }

  @Override
  public String format() {
    return FORMAT;
  }

  @Override
  public <T> T decode(byte[] body, Type type) {
    String text = new String(body, StandardCharsets.UTF_8);
    // Gson maps an empty document to null instead of failing.
    if (text.isBlank()) {
      throw new ResponseDecodeException(
          INVALID_JSON, FORMAT, new JsonParseException("empty JSON document"));
    }
    try {
      return gson.fromJson(text, type);
    } catch (JsonParseException e) {
      throw new ResponseDecodeException(INVALID_JSON, FORMAT, e);
    }
  }
}
