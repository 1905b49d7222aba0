package io.github.wphillipmoore.http.utils.codec;

import io.github.wphillipmoore.http.utils.exception.ResponseDecodeException;
import java.lang.reflect.Type;

/**
 * Decodes a raw response body into a caller-chosen type.
 *
 * <p>Implementations must be thread-safe; a single instance is shared by every call.
 */
public interface BodyDecoder {

  /**
   * Returns the name of the format this decoder reads, used in error reporting.
   *
   * @return the format name, e.g. {@code "JSON"}
   */
  String format();

  /**
   * Decodes the body into an instance of {@code type}.
   *
   * @param body the raw response bytes, never empty
   * @param type the target type, either a {@link Class} or a parameterized type
   * @param <T> the decoded type
   * @return the decoded value
   * @throws ResponseDecodeException if the body is not valid for this format or the target type
   */
  <T> T decode(byte[] body, Type type);
}
