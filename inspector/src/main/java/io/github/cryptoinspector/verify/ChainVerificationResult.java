package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.cryptoinspector.exception.ChainDiscontinuityException;
import io.github.cryptoinspector.exception.ChainTamperException;
import java.util.List;
import org.immutables.value.Value;

/**
 * Outcome of walking an audit chain.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableChainVerificationResult.class)
public interface ChainVerificationResult {

  @JsonProperty("ok")
  boolean ok();

  @JsonProperty("total")
  int total();

  /**
   * Number of events with at least one failed check.
   *
   * @return the count
   */
  @JsonProperty("failed")
  int failed();

  @JsonProperty("prev_hash_failed")
  int prevHashFailed();

  @JsonProperty("chain_hash_failed")
  int chainHashFailed();

  /**
   * Chain hash of the last event walked, empty for an empty chain.
   *
   * @return the hash
   */
  @JsonProperty("last_chain_hash")
  String lastChainHash();

  @JsonProperty("failures")
  List<ChainFailure> failures();

  /**
   * Throw unless the chain verified.
   *
   * @return this result
   * @throws ChainTamperException        if any event's hash does not match its contents
   * @throws ChainDiscontinuityException if only the links between events are broken
   */
  default ChainVerificationResult requireOk() {
    if (ok()) {
      return this;
    }
    if (chainHashFailed() > 0) {
      throw new ChainTamperException(chainHashFailed() + " of " + total() + " audit events do not match their hash");
    }
    throw new ChainDiscontinuityException(prevHashFailed() + " of " + total() + " audit events are not linked");
  }
}
