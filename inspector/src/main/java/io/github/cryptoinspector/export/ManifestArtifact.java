package io.github.cryptoinspector.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.cryptoinspector.model.Artifact;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableManifestArtifact.class)
@JsonDeserialize(as = ImmutableManifestArtifact.class)
public interface ManifestArtifact {

  @JsonProperty("artifact")
  Artifact artifact();

  @JsonProperty("zip_path")
  String zipPath();
}
