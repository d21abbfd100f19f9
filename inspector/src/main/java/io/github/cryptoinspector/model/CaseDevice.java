package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A device examined within a case.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCaseDevice.class)
@JsonDeserialize(as = ImmutableCaseDevice.class)
public interface CaseDevice {

  @JsonProperty("device_id")
  String deviceId();

  @JsonProperty("case_id")
  String caseId();

  /**
   * One of windows, macos, android, ios.
   *
   * @return the os type
   */
  @JsonProperty("os_type")
  String osType();

  @JsonProperty("device_name")
  String deviceName();

  /**
   * Stable identifier derived from host properties, not a hardware serial.
   *
   * @return the identifier
   */
  @JsonProperty("identifier")
  String identifier();

  /**
   * Either local or usb.
   *
   * @return the connection type
   */
  @JsonProperty("connection_type")
  String connectionType();

  @JsonProperty("authorized")
  boolean authorized();

  @JsonProperty("auth_note")
  String authNote();

  /**
   * First registration time, assigned by the device manager.
   *
   * @return epoch millis
   */
  @JsonProperty("first_seen_at")
  @Value.Default
  default long firstSeenAt() {
    return 0L;
  }

  @JsonProperty("last_seen_at")
  @Value.Default
  default long lastSeenAt() {
    return 0L;
  }
}
