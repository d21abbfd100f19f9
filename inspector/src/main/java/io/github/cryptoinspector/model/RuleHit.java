package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * A match produced by the rule engine. Hits reference artifacts, they never own them.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRuleHit.class)
@JsonDeserialize(as = ImmutableRuleHit.class)
public interface RuleHit {

  @JsonProperty("hit_id")
  String hitId();

  @JsonProperty("case_id")
  String caseId();

  @JsonProperty("device_id")
  String deviceId();

  @JsonProperty("hit_type")
  HitType hitType();

  @JsonProperty("rule_id")
  String ruleId();

  @JsonProperty("rule_name")
  String ruleName();

  @JsonProperty("rule_version")
  String ruleVersion();

  /**
   * The domain, extension id, app name or address that triggered the rule.
   *
   * @return the value
   */
  @JsonProperty("matched_value")
  String matchedValue();

  @JsonProperty("first_seen_at")
  long firstSeenAt();

  @JsonProperty("last_seen_at")
  long lastSeenAt();

  @JsonProperty("confidence")
  double confidence();

  @JsonProperty("verdict")
  Verdict verdict();

  @JsonProperty("detail_json")
  String detailJson();

  /**
   * Artifacts the hit was read from directly.
   *
   * @return the ids
   */
  @JsonProperty("artifact_ids")
  List<String> artifactIds();

  /**
   * Artifacts the hit was inferred from.
   *
   * @return the ids
   */
  @JsonProperty("derived_artifact_ids")
  List<String> derivedArtifactIds();

}
