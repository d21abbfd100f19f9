package io.github.cryptoinspector.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * What a packaged file is.
 */
public enum FileKind {
  ARTIFACT, REPORT, RULE, MANIFEST;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static FileKind fromValue(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
