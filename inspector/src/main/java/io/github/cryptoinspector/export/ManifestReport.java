package io.github.cryptoinspector.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.cryptoinspector.model.Report;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableManifestReport.class)
@JsonDeserialize(as = ImmutableManifestReport.class)
public interface ManifestReport {

  @JsonProperty("report")
  Report report();

  @JsonProperty("zip_path")
  String zipPath();
}
