package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Per artifact verification item.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableArtifactCheck.class)
public interface ArtifactCheck {

  @JsonProperty("artifact_id")
  String artifactId();

  @JsonProperty("snapshot_path")
  String snapshotPath();

  @JsonProperty("status")
  ArtifactCheckStatus status();

  @JsonProperty("expected_sha256")
  String expectedSha256();

  /**
   * Hash of the file as it is now, absent when it could not be read.
   *
   * @return the hash
   */
  @JsonProperty("actual_sha256")
  Optional<String> actualSha256();

  @JsonProperty("expected_size")
  long expectedSize();

  @JsonProperty("actual_size")
  Optional<Long> actualSize();

  @JsonProperty("message")
  String message();
}
