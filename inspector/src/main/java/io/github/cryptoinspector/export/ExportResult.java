package io.github.cryptoinspector.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Summary of one export run.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableExportResult.class)
@JsonDeserialize(as = ImmutableExportResult.class)
public interface ExportResult {

  @JsonProperty("case_id")
  String caseId();

  @JsonProperty("report_id")
  String reportId();

  @JsonProperty("zip_path")
  String zipPath();

  @JsonProperty("zip_sha256")
  String zipSha256();

  @JsonProperty("warnings")
  List<String> warnings();

  /**
   * True when the calling thread was interrupted and the package is partial.
   *
   * @return cancelled
   */
  @JsonProperty("cancelled")
  boolean cancelled();

  @JsonProperty("started_at")
  long startedAt();

  @JsonProperty("finished_at")
  long finishedAt();
}
