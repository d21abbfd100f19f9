package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.cryptoinspector.exception.IntegrityException;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Outcome of verifying a forensic package offline.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableZipVerificationResult.class)
public interface ZipVerificationResult {

  @JsonProperty("zip_path")
  String zipPath();

  /**
   * True when every entry matched and the packaged audit chain, if any, verified.
   *
   * @return ok
   */
  @JsonProperty("ok")
  boolean ok();

  @JsonProperty("total")
  int total();

  @JsonProperty("ok_count")
  int okCount();

  @JsonProperty("failed")
  int failed();

  @JsonProperty("items")
  List<ZipEntryCheck> items();

  /**
   * One human readable line per failed entry.
   *
   * @return the diffs
   */
  @JsonProperty("diffs")
  List<String> diffs();

  /**
   * Result of walking the manifest's audit events, absent when the package has no manifest.
   *
   * @return the chain result
   */
  @JsonProperty("audit_chain")
  Optional<ChainVerificationResult> auditChain();

  /**
   * Throw unless the package verified.
   *
   * @return this result
   */
  default ZipVerificationResult requireOk() {
    if (!ok()) {
      final String reason = failed() > 0
          ? failed() + " of " + total() + " entries failed"
          : "audit chain in manifest does not verify";
      throw new IntegrityException("forensic package " + zipPath() + ": " + reason);
    }
    return this;
  }
}
