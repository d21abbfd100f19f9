package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Case row plus record counts.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCaseOverview.class)
@JsonDeserialize(as = ImmutableCaseOverview.class)
public interface CaseOverview {

  @JsonProperty("case_id")
  String caseId();

  @JsonProperty("case_no")
  Optional<String> caseNo();

  @JsonProperty("title")
  String title();

  @JsonProperty("status")
  CaseStatus status();

  @JsonProperty("created_by")
  String createdBy();

  @JsonProperty("note")
  String note();

  @JsonProperty("created_at")
  long createdAt();

  @JsonProperty("updated_at")
  long updatedAt();

  @JsonProperty("device_count")
  long deviceCount();

  @JsonProperty("artifact_count")
  long artifactCount();

  @JsonProperty("hit_count")
  long hitCount();

  @JsonProperty("report_count")
  long reportCount();
}
