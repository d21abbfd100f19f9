package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle state of a case.
 */
public enum CaseStatus {
  OPEN, CLOSED, ARCHIVED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static CaseStatus fromValue(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
