package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kinds of evidence a collector can acquire.
 */
public enum ArtifactType {
  INSTALLED_APPS, BROWSER_HISTORY, BROWSER_EXTENSION, BROWSER_HISTORY_DB, MOBILE_PACKAGES, MOBILE_BACKUP, CHAIN_BALANCE;

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
  public static ArtifactType fromValue(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
