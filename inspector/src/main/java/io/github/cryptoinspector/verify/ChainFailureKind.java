package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Why an audit event failed the chain walk.
 */
public enum ChainFailureKind {
  /**
   * The event's stored previous hash is not the chain hash of the event before it.
   */
  PREV_HASH,
  /**
   * The event's chain hash does not match its own fields.
   */
  CHAIN_HASH;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
