package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Outcome of a precondition check performed before acquisition, kept so the package shows why
 * evidence was or was not collectable.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePrecheckResult.class)
@JsonDeserialize(as = ImmutablePrecheckResult.class)
public interface PrecheckResult {

  @JsonProperty("check_id")
  String checkId();

  @JsonProperty("case_id")
  String caseId();

  @JsonProperty("device_id")
  Optional<String> deviceId();

  @JsonProperty("scan_scope")
  ScanScope scanScope();

  @JsonProperty("check_code")
  String checkCode();

  @JsonProperty("check_name")
  String checkName();

  @JsonProperty("required")
  boolean required();

  @JsonProperty("status")
  PrecheckStatus status();

  @JsonProperty("message")
  String message();

  @JsonProperty("detail_json")
  @Value.Default
  default String detailJson() {
    return "{}";
  }

  /**
   * Check time in epoch millis. Zero until stored.
   *
   * @return the time
   */
  @JsonProperty("checked_at")
  @Value.Default
  default long checkedAt() {
    return 0L;
  }

  /**
   * Hash over the check's fields, assigned when stored.
   *
   * @return the hash
   */
  @JsonProperty("record_hash")
  @Value.Default
  default String recordHash() {
    return "";
  }
}
