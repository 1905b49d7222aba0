package io.github.wphillipmoore.http.utils.multipart;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MultipartBodyTest {

  private static final String BOUNDARY = "test-boundary";

  private static String text(MultipartBody body) {
    return new String(body.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  void writesFieldsThenFileThenClosingBoundary() {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("title", "Report");
    fields.put("owner", "ops");
    FileItem file = new FileItem("upload", "r.txt", "hello".getBytes(StandardCharsets.UTF_8));

    MultipartBody body = MultipartBody.of(fields, file, BOUNDARY);

    assertThat(text(body))
        .isEqualTo(
            "--test-boundary\r\n"
                + "Content-Disposition: form-data; name=\"title\"\r\n\r\n"
                + "Report"
                + "\r\n--test-boundary\r\n"
                + "Content-Disposition: form-data; name=\"owner\"\r\n\r\n"
                + "ops"
                + "\r\n--test-boundary\r\n"
                + "Content-Disposition: form-data; name=\"upload\"; filename=\"r.txt\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n"
                + "hello"
                + "\r\n--test-boundary--\r\n");
  }

  @Test
  void fileOnlyBodyStartsWithBoundary() {
    FileItem file = new FileItem("f", "a.bin", new byte[] {0x01});

    String text = text(MultipartBody.of(null, file, BOUNDARY));

    assertThat(text).startsWith("--test-boundary\r\nContent-Disposition: form-data; name=\"f\"");
    assertThat(text).endsWith("\r\n--test-boundary--\r\n");
  }

  @Test
  void fileBytesAreWrittenVerbatim() {
    byte[] content = {0x00, (byte) 0xff, 0x0d, 0x0a};
    MultipartBody body = MultipartBody.of(Map.of(), new FileItem("f", "b", content), BOUNDARY);

    byte[] bytes = body.toByteArray();
    byte[] header =
        ("--test-boundary\r\n"
                + "Content-Disposition: form-data; name=\"f\"; filename=\"b\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n")
            .getBytes(StandardCharsets.UTF_8);
    byte[] written = new byte[content.length];
    System.arraycopy(bytes, header.length, written, 0, content.length);

    assertThat(written).containsExactly(content);
  }

  @Test
  void contentTypeCarriesBoundary() {
    MultipartBody body = MultipartBody.of(null, new FileItem("f", "a", new byte[0]), BOUNDARY);

    assertThat(body.contentType()).isEqualTo("multipart/form-data; boundary=test-boundary");
    assertThat(body.boundary()).isEqualTo(BOUNDARY);
  }

  @Test
  void generatedBoundaryIsSixtyHexCharacters() {
    MultipartBody body = MultipartBody.of(null, new FileItem("f", "a", new byte[0]));

    assertThat(body.boundary()).hasSize(60).matches("[0-9a-f]+");
  }

  @Test
  void generatedBoundariesDiffer() {
    assertThat(MultipartBody.randomBoundary()).isNotEqualTo(MultipartBody.randomBoundary());
  }

  @Test
  void quotesAndBackslashesAreEscaped() {
    assertThat(MultipartBody.escapeQuotes("a\"b\\c")).isEqualTo("a\\\"b\\\\c");

    String text =
        text(MultipartBody.of(null, new FileItem("f", "my \"file\".txt", new byte[0]), BOUNDARY));

    assertThat(text).contains("filename=\"my \\\"file\\\".txt\"");
  }

  @Test
  void nullFileThrows() {
    assertThatThrownBy(() -> MultipartBody.of(Map.of(), null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("file");
  }
}
