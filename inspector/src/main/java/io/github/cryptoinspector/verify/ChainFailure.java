package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * One failed check of the chain walk.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableChainFailure.class)
public interface ChainFailure {

  /**
   * Zero based position of the event in chain order.
   *
   * @return the index
   */
  @JsonProperty("index")
  int index();

  @JsonProperty("event_id")
  String eventId();

  @JsonProperty("kind")
  ChainFailureKind kind();

  @JsonProperty("expected")
  String expected();

  @JsonProperty("actual")
  String actual();
}
