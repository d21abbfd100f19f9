package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.cryptoinspector.exception.IntegrityException;
import java.util.List;
import org.immutables.value.Value;

/**
 * Outcome of re-hashing a case's artifacts.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableArtifactVerificationResult.class)
public interface ArtifactVerificationResult {

  @JsonProperty("case_id")
  String caseId();

  @JsonProperty("ok")
  boolean ok();

  @JsonProperty("ok_count")
  int okCount();

  @JsonProperty("mismatch_count")
  int mismatchCount();

  @JsonProperty("missing_count")
  int missingCount();

  @JsonProperty("error_count")
  int errorCount();

  @JsonProperty("items")
  List<ArtifactCheck> items();

  /**
   * Throw unless every artifact verified.
   *
   * @return this result
   */
  default ArtifactVerificationResult requireOk() {
    if (!ok()) {
      throw new IntegrityException("artifact verification failed for " + caseId() + ": "
          + mismatchCount() + " mismatch, " + missingCount() + " missing, " + errorCount() + " error");
    }
    return this;
  }
}
