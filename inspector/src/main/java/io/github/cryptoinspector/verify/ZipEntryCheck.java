package io.github.cryptoinspector.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableZipEntryCheck.class)
public interface ZipEntryCheck {

  @JsonProperty("path")
  String path();

  @JsonProperty("status")
  ZipEntryStatus status();

  @JsonProperty("expected_sha256")
  Optional<String> expectedSha256();

  @JsonProperty("actual_sha256")
  Optional<String> actualSha256();

  @JsonProperty("message")
  String message();
}
