package io.github.cryptoinspector.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.cryptoinspector.model.AppInfo;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.CaseDevice;
import io.github.cryptoinspector.model.CaseOverview;
import io.github.cryptoinspector.model.PrecheckResult;
import io.github.cryptoinspector.model.RuleHit;
import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Contents of {@code manifest.json}: the case's database state at export time, with archive
 * paths for every packaged file.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableForensicManifest.class)
@JsonDeserialize(as = ImmutableForensicManifest.class)
public interface ForensicManifest {

  /**
   * Manifest format identifier.
   */
  String SCHEMA_V1 = "crypto_inspector.forensic_export_manifest.v1";

  @JsonProperty("schema")
  String schema();

  /**
   * Epoch millis.
   *
   * @return the time
   */
  @JsonProperty("generated_at")
  long generatedAt();

  @JsonProperty("app")
  AppInfo app();

  @JsonProperty("case")
  CaseOverview caseOverview();

  @JsonProperty("devices")
  List<CaseDevice> devices();

  @JsonProperty("artifacts")
  List<ManifestArtifact> artifacts();

  @JsonProperty("hits")
  List<RuleHit> hits();

  @JsonProperty("prechecks")
  List<PrecheckResult> prechecks();

  /**
   * The case's complete audit chain from its first event, so the package can be walked on its
   * own.
   *
   * @return the audits
   */
  @JsonProperty("audits")
  List<AuditEvent> audits();

  @JsonProperty("reports")
  List<ManifestReport> reports();

  /**
   * Packaged files sorted by path. Does not list the manifest itself.
   *
   * @return the files
   */
  @JsonProperty("files")
  List<ManifestFileEntry> files();

  @JsonProperty("warnings")
  List<String> warnings();

  @JsonProperty("note")
  String note();

  @JsonProperty("extra")
  Map<String, Object> extra();

  @JsonProperty("stats")
  Map<String, Long> stats();
}
