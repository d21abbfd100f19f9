package io.github.cryptoinspector.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A file inside the package with the hash computed while it was written.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableManifestFileEntry.class)
@JsonDeserialize(as = ImmutableManifestFileEntry.class)
public interface ManifestFileEntry {

  /**
   * Path inside the archive, always {@code /} separated.
   *
   * @return the path
   */
  @JsonProperty("path")
  String path();

  @JsonProperty("sha256")
  String sha256();

  @JsonProperty("size_bytes")
  long sizeBytes();

  @JsonProperty("kind")
  FileKind kind();
}
