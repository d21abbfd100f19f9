package io.github.cryptoinspector.model;

import org.immutables.value.Value;

/**
 * Row of the hit to artifact link table.
 */
@Value.Immutable
public interface HitArtifactLink {

  String hitId();

  String artifactId();

  LinkRelation relation();

  long createdAt();
}
