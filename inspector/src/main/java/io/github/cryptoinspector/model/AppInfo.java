package io.github.cryptoinspector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Build identification stamped into every forensic manifest.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAppInfo.class)
@JsonDeserialize(as = ImmutableAppInfo.class)
public interface AppInfo {

  /**
   * App info for builds that carry no version stamp.
   *
   * @return the app info
   */
  static AppInfo unknown() {
    return ImmutableAppInfo.builder().version("dev").commit("unknown").buildTime("unknown").build();
  }

  @JsonProperty("version")
  String version();

  @JsonProperty("commit")
  String commit();

  @JsonProperty("build_time")
  String buildTime();
}
