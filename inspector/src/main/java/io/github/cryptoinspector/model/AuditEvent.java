package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One link of a case's audit chain.
 *
 * <p>{@code chainHash} is computed over {@code chainPrevHash}, the case, event type, action,
 * status, occurrence time and the detail text. The first event of a case has an empty
 * {@code chainPrevHash}; every later event carries the {@code chainHash} of its predecessor.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAuditEvent.class)
@JsonDeserialize(as = ImmutableAuditEvent.class)
public interface AuditEvent {

  @JsonProperty("event_id")
  String eventId();

  @JsonProperty("case_id")
  String caseId();

  @JsonProperty("device_id")
  Optional<String> deviceId();

  @JsonProperty("event_type")
  String eventType();

  @JsonProperty("action")
  String action();

  @JsonProperty("status")
  AuditStatus status();

  @JsonProperty("actor")
  String actor();

  @JsonProperty("source")
  String source();

  /**
   * Compact JSON detail, hashed exactly as stored.
   *
   * @return the detail
   */
  @JsonProperty("detail_json")
  String detailJson();

  /**
   * Epoch milliseconds. Strictly increasing within a case.
   *
   * @return the time
   */
  @JsonProperty("occurred_at")
  long occurredAt();

  @JsonProperty("chain_prev_hash")
  String chainPrevHash();

  @JsonProperty("chain_hash")
  String chainHash();
}
