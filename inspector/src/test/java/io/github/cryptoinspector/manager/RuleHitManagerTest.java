package io.github.cryptoinspector.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.cryptoinspector.endToEnd.BaseEndToEndTest;
import io.github.cryptoinspector.model.Artifact;
import io.github.cryptoinspector.model.ArtifactType;
import io.github.cryptoinspector.model.HitType;
import io.github.cryptoinspector.model.ImmutableRuleHit;
import io.github.cryptoinspector.model.RuleHit;
import io.github.cryptoinspector.model.Verdict;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RuleHitManagerTest extends BaseEndToEndTest {

  private static ImmutableRuleHit.Builder hit(final String hitId) {
    return ImmutableRuleHit.builder()
        .hitId(hitId)
        .caseId("C1")
        .deviceId("D1")
        .hitType(HitType.WALLET_INSTALLED)
        .ruleId("wallet.metamask")
        .ruleName("MetaMask")
        .ruleVersion("2024.1")
        .matchedValue("MetaMask")
        .firstSeenAt(100L)
        .lastSeenAt(200L)
        .confidence(0.9)
        .verdict(Verdict.CONFIRMED)
        .detailJson("{}");
  }

  @Test
  void saveHits_storesHitsWithDirectAndDerivedLinks() throws Exception {
    // Given
    final Artifact apps = component.artifactStore()
        .put("C1", "D1", ArtifactType.INSTALLED_APPS, "registry", "scan", Map.of("k", 1));
    final Artifact history = component.artifactStore()
        .put("C1", "D1", ArtifactType.BROWSER_HISTORY, "chrome", "scan", Map.of("k", 2));

    // When
    component.ruleHitManager().saveHits(List.of(
        hit("H1").addArtifactIds(history.artifactId(), apps.artifactId())
            .addDerivedArtifactIds(apps.artifactId())
            .build(),
        hit("H2").build()));

    // Then
    final List<RuleHit> hits = component.ruleHitManager().listHitDetails("C1");
    assertThat(hits).extracting(RuleHit::hitId).containsExactly("H1", "H2");
    assertThat(hits.get(0).artifactIds())
        .containsExactlyElementsOf(List.of(apps.artifactId(), history.artifactId()).stream().sorted().toList());
    assertThat(hits.get(0).derivedArtifactIds()).containsExactly(apps.artifactId());
    assertThat(hits.get(1).artifactIds()).isEmpty();
    assertThat(hits.get(0).verdict()).isEqualTo(Verdict.CONFIRMED);
    assertThat(component.caseManager().overview("C1").hitCount()).isEqualTo(2L);
  }

  @Test
  void saveHits_confidenceOutOfRange_isRejected() {
    assertThatThrownBy(() -> component.ruleHitManager().saveHits(List.of(hit("H1").confidence(1.5).build())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("H1");
    assertThat(component.ruleHitManager().listHitDetails("C1")).isEmpty();
  }
}
