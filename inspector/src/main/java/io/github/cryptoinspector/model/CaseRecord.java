package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The case row. All other records are scoped by its id.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCaseRecord.class)
@JsonDeserialize(as = ImmutableCaseRecord.class)
public interface CaseRecord {

  @JsonProperty("case_id")
  String caseId();

  /**
   * Warrant or work order number the case was opened under.
   *
   * @return the number
   */
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
}
