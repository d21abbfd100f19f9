package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Result of re-hashing one artifact.
 */
public enum ArtifactCheckStatus {
  OK, MISMATCH, MISSING, ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
