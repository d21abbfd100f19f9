package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Result of checking one archive entry against the digest list.
 */
public enum ZipEntryStatus {
  OK,
  MISMATCH,
  /**
   * Listed in the digest list but absent from the archive.
   */
  MISSING,
  /**
   * Present in the archive but absent from the digest list.
   */
  UNLISTED,
  /**
   * The archive holds more than one entry under the same name.
   */
  DUPLICATE,
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
