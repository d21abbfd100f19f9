package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * An immutable evidence record: the snapshot file written by a collector and the metadata that
 * binds it to a case. The record hash covers every field below together with the payload, so
 * a change to the row is detectable even when the file is untouched.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableArtifact.class)
@JsonDeserialize(as = ImmutableArtifact.class)
public interface Artifact {

  @JsonProperty("artifact_id")
  String artifactId();

  @JsonProperty("case_id")
  String caseId();

  @JsonProperty("device_id")
  String deviceId();

  @JsonProperty("artifact_type")
  ArtifactType artifactType();

  @JsonProperty("source_ref")
  String sourceRef();

  /**
   * Absolute path of the snapshot file.
   *
   * @return the path
   */
  @JsonProperty("snapshot_path")
  String snapshotPath();

  /**
   * SHA-256 of the snapshot file bytes, lower case hex.
   *
   * @return the digest
   */
  @JsonProperty("sha256")
  String sha256();

  @JsonProperty("size_bytes")
  long sizeBytes();

  /**
   * Acquisition time in epoch milliseconds.
   *
   * @return the time
   */
  @JsonProperty("collected_at")
  long collectedAt();

  @JsonProperty("collector_name")
  String collectorName();

  @JsonProperty("collector_version")
  String collectorVersion();

  @JsonProperty("acquisition_method")
  String acquisitionMethod();

  /**
   * The serialized payload, identical to the snapshot file contents.
   *
   * @return the payload
   */
  @JsonProperty("payload_json")
  String payloadJson();

  @JsonProperty("record_hash")
  String recordHash();
}
