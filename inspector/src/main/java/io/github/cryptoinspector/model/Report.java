package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Index entry for a generated report file.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableReport.class)
@JsonDeserialize(as = ImmutableReport.class)
public interface Report {

  @JsonProperty("report_id")
  String reportId();

  @JsonProperty("case_id")
  String caseId();

  @JsonProperty("report_type")
  ReportType reportType();

  @JsonProperty("file_path")
  String filePath();

  @JsonProperty("sha256")
  String sha256();

  @JsonProperty("generated_at")
  long generatedAt();

  @JsonProperty("generator_version")
  String generatorVersion();

  @JsonProperty("status")
  ReportStatus status();
}
