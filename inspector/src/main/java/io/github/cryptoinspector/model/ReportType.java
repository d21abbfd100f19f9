package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kinds of generated report files.
 */
public enum ReportType {
  INTERNAL_HTML, INTERNAL_JSON, FORENSIC_PDF, FORENSIC_ZIP;

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
  public static ReportType fromValue(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
