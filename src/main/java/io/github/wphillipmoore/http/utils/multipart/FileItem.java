package io.github.wphillipmoore.http.utils.multipart;

import java.util.Arrays;
import java.util.Objects;

/**
 * A single file to upload as one field of a multipart body.
 *
 * <p>The content array is defensively copied on construction and on access.
 *
 * @param key the form field name, never null
 * @param fileName the file name reported to the server, never null
 * @param content the raw file bytes, never null
 */
public record FileItem(String key, String fileName, byte[] content) {

  /** Validates non-null fields and copies the content. */
  public FileItem {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(fileName, "fileName");
    content = Objects.requireNonNull(content, "content").clone();
  }

  /** Returns a copy of the file bytes. */
  @Override
  public byte[] content() {
    return content.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof FileItem item)) {
      return false;
    }
    return key.equals(item.key)
        && fileName.equals(item.fileName)
        && Arrays.equals(content, item.content);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, fileName, Arrays.hashCode(content));
  }

  @Override
  public String toString() {
    return "FileItem[key=" + key + ", fileName=" + fileName + ", size=" + content.length + "]";
  }
}
