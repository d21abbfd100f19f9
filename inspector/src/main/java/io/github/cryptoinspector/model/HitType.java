package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * What a rule hit detected.
 */
public enum HitType {
  WALLET_INSTALLED, EXCHANGE_VISITED, WALLET_ADDRESS, TOKEN_BALANCE;

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
  public static HitType fromValue(final String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
