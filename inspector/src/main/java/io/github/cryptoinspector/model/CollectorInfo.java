package io.github.cryptoinspector.model;

import org.immutables.value.Value;

/**
 * Identity of the collector that acquired an artifact.
 */
@Value.Immutable
public interface CollectorInfo {

  @Value.Parameter
  String name();

  @Value.Parameter
  String version();

  static CollectorInfo of(final String name, final String version) {
    return ImmutableCollectorInfo.of(name, version);
  }
}
