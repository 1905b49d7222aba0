package io.github.wphillipmoore.http.utils.multipart;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A fully written {@code multipart/form-data} body.
 *
 * <p>Text fields are written first, in the iteration order of the supplied map, followed by the
 * single file field. The closing boundary is always present.
 *
 * <pre>{@code
 * MultipartBody body = MultipartBody.of(
 *     Map.of("description", "monthly report"),
 *     new FileItem("upload", "report.csv", bytes));
 * String contentType = body.contentType();
 * }</pre>
 */
public final class MultipartBody {

  static final String FILE_CONTENT_TYPE = "application/octet-stream";

  private static final String CRLF = "\r\n";
  private static final int BOUNDARY_BYTES = 30;
  private static final SecureRandom RANDOM = new SecureRandom();

  private final String boundary;
  private final byte[] bytes;

  private MultipartBody(String boundary, byte[] bytes) {
    this.boundary = boundary;
    this.bytes = bytes;
  }

  /**
   * Writes a multipart body with a freshly generated boundary.
   *
   * @param fields text fields to write before the file, or {@code null} for none
   * @param file the file field
   * @return the written body
   */
  public static MultipartBody of(@Nullable Map<String, String> fields, FileItem file) {
    return of(fields, file, randomBoundary());
  }

  /**
   * Writes a multipart body with the given boundary. Package-private for testing.
   *
   * @param fields text fields to write before the file, or {@code null} for none
   * @param file the file field
   * @param boundary the boundary delimiter
   * @return the written body
   */
  static MultipartBody of(@Nullable Map<String, String> fields, FileItem file, String boundary) {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(boundary, "boundary");

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    boolean first = true;
    if (fields != null) {
      for (Map.Entry<String, String> field : fields.entrySet()) {
        writeBoundary(out, boundary, first);
        first = false;
        writeText(out, "Content-Disposition: form-data; name=\"" + escapeQuotes(field.getKey())
            + "\"" + CRLF + CRLF);
        writeText(out, field.getValue());
      }
    }

    writeBoundary(out, boundary, first);
    writeText(out, "Content-Disposition: form-data; name=\"" + escapeQuotes(file.key())
        + "\"; filename=\"" + escapeQuotes(file.fileName()) + "\"" + CRLF);
    writeText(out, "Content-Type: " + FILE_CONTENT_TYPE + CRLF + CRLF);
    out.writeBytes(file.content());

    writeText(out, CRLF + "--" + boundary + "--" + CRLF);
    return new MultipartBody(boundary, out.toByteArray());
  }

  /** Returns the boundary delimiter used by this body. */
  public String boundary() {
    return boundary;
  }

  /**
   * Returns the {@code Content-Type} header value for this body, including its boundary.
   *
   * @return the content type
   */
  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  /** Returns a copy of the encoded body. */
  public byte[] toByteArray() {
    return bytes.clone();
  }

  static String randomBoundary() {
    byte[] buf = new byte[BOUNDARY_BYTES];
    RANDOM.nextBytes(buf);
    return HexFormat.of().formatHex(buf);
  }

  static String escapeQuotes(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static void writeBoundary(ByteArrayOutputStream out, String boundary, boolean first) {
    writeText(out, (first ? "" : CRLF) + "--" + boundary + CRLF);
  }

  private static void writeText(ByteArrayOutputStream out, String text) {
    out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }
}
