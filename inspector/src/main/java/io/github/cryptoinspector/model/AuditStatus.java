package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Outcome recorded on an audit event.
 */
public enum AuditStatus {
  STARTED, SUCCESS, FAILED, SKIPPED;

  /**
   * Lower case wire value, used in JSON and in hash inputs.
   *
   * @return the value
   */
  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse a wire value.
   *
   * @param value the value
   * @return the enum constant
   */
  @JsonCreator
  public static AuditStatus fromValue(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
