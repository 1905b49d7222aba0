package io.github.wphillipmoore.http.utils.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.github.wphillipmoore.http.utils.exception.ResponseDecodeException;
import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Jackson {@link XmlMapper}-backed {@link BodyDecoder} for XML response bodies.
 *
 * <p>Elements with no matching property on the target type are ignored.
 */
public final class XmlBodyDecoder implements BodyDecoder {

  /** Shared instance using a lenient default {@link XmlMapper}. */
  public static final XmlBodyDecoder INSTANCE = new XmlBodyDecoder(defaultMapper());

  static final String FORMAT = "XML";

  private final XmlMapper mapper;

  /**
   * Creates a decoder backed by the given mapper. The mapper must not be reconfigured afterwards.
   *
   * @param mapper the XML mapper to use
   */
  public XmlBodyDecoder(XmlMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  static XmlMapper defaultMapper() {
    XmlMapper mapper = new XmlMapper();
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    return mapper;
  }

  @Override
  public String format() {
    return FORMAT;
  }

  @Override
  public <T> T decode(byte[] body, Type type) {
    try {
      return mapper.readValue(body, mapper.getTypeFactory().constructType(type));
    } catch (IOException e) {
      throw new ResponseDecodeException("Invalid XML in response", FORMAT, e);
    }
  }
}
