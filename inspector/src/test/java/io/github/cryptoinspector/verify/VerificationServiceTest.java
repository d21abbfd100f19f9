package io.github.cryptoinspector.verify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.cryptoinspector.endToEnd.BaseEndToEndTest;
import io.github.cryptoinspector.exception.NotFoundException;
import io.github.cryptoinspector.model.Artifact;
import io.github.cryptoinspector.model.ArtifactType;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.AuditStatus;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VerificationServiceTest extends BaseEndToEndTest {

  private VerificationService verificationService;
  private Artifact apps;
  private Artifact history;

  @BeforeEach
  void collect() throws Exception {
    verificationService = component.verificationService();
    apps = component.artifactStore()
        .put("C1", "D1", ArtifactType.INSTALLED_APPS, "registry", "scan", Map.of("apps", List.of("MetaMask")));
    history = component.artifactStore()
        .put("C1", "D1", ArtifactType.BROWSER_HISTORY, "chrome", "scan", Map.of("urls", List.of("binance.com")));
    component.auditChain().append("C1", "D1", "collect", "installed_apps", AuditStatus.SUCCESS, "tester",
        "VerificationServiceTest", Map.of("artifact_id", apps.artifactId()));
    component.auditChain().append("C1", "D1", "collect", "browser_history", AuditStatus.SUCCESS, "tester",
        "VerificationServiceTest", Map.of("artifact_id", history.artifactId()));
  }

  private AuditEvent lastEvent() {
    return component.auditChain().tail("C1").orElseThrow();
  }

  @Test
  void verifyArtifacts_untouched() {
    final ArtifactVerificationResult result = verificationService.verifyArtifacts("C1");

    assertThat(result.ok()).isTrue();
    assertThat(result.okCount()).isEqualTo(2);
    assertThat(result.items()).extracting(ArtifactCheck::status)
        .containsOnly(ArtifactCheckStatus.OK);
    assertThat(lastEvent().eventType()).isEqualTo("verify");
    assertThat(lastEvent().action()).isEqualTo("artifacts");
    assertThat(lastEvent().status()).isEqualTo(AuditStatus.SUCCESS);
    assertThat(lastEvent().source()).isEqualTo("VerificationService.verifyArtifacts");
  }

  @Test
  void verifyArtifacts_alteredAndDeletedSnapshots() throws Exception {
    Files.write(Path.of(apps.snapshotPath()), "{\"apps\":[]}".getBytes(StandardCharsets.UTF_8));
    Files.delete(Path.of(history.snapshotPath()));

    final ArtifactVerificationResult result = verificationService.verifyArtifacts("C1");

    assertThat(result.ok()).isFalse();
    assertThat(result.mismatchCount()).isEqualTo(1);
    assertThat(result.missingCount()).isEqualTo(1);
    assertThat(result.items()).filteredOn(i -> i.artifactId().equals(apps.artifactId()))
        .singleElement()
        .satisfies(i -> {
          assertThat(i.status()).isEqualTo(ArtifactCheckStatus.MISMATCH);
          assertThat(i.actualSha256()).isPresent().get().isNotEqualTo(apps.sha256());
        });
    assertThat(lastEvent().status()).isEqualTo(AuditStatus.FAILED);
    assertThat(lastEvent().detailJson()).contains("\"mismatch\":1").contains("\"missing\":1");
  }

  @Test
  void verifyArtifacts_singleArtifact() {
    final ArtifactVerificationResult result = verificationService.verifyArtifacts("C1", history.artifactId());

    assertThat(result.items()).extracting(ArtifactCheck::artifactId).containsExactly(history.artifactId());
    assertThat(lastEvent().detailJson()).contains(history.artifactId());
  }

  @Test
  void verifyArtifacts_unknownArtifact_recordsFailureAndThrows() {
    assertThatThrownBy(() -> verificationService.verifyArtifacts("C1", "art_missing"))
        .isInstanceOf(NotFoundException.class);

    assertThat(lastEvent().status()).isEqualTo(AuditStatus.FAILED);
    assertThat(lastEvent().detailJson()).contains("art_missing");
  }

  @Test
  void verifyArtifacts_caseWithoutArtifacts_isOk() {
    component.caseManager().ensureCase("C2");

    final ArtifactVerificationResult result = verificationService.verifyArtifacts("C2");

    assertThat(result.ok()).isTrue();
    assertThat(result.items()).isEmpty();
  }

  @Test
  void verifyArtifacts_artifactOfAnotherCase_throws() {
    component.caseManager().ensureCase("C2");

    assertThatThrownBy(() -> verificationService.verifyArtifacts("C2", apps.artifactId()))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void verifyArtifacts_unknownCase_throws() {
    assertThatThrownBy(() -> verificationService.verifyArtifacts("nope"))
        .isInstanceOf(NotFoundException.class);
    assertThat(component.caseManager().find("nope")).isEmpty();
  }

  @Test
  void verifyArtifacts_blankCaseId_isRejected() {
    assertThatThrownBy(() -> verificationService.verifyArtifacts(" "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("case id is required");
    assertThatThrownBy(() -> verificationService.verifyAuditChain(null, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void verifyArtifacts_rewrittenRecord_isARecordHashMismatch() {
    component.jdbi().useHandle(handle -> {
      handle.execute("DROP TRIGGER TRG_ARTIFACT_NO_UPDATE");
      handle.execute("UPDATE ARTIFACT SET PAYLOAD_JSON = ? WHERE ARTIFACT_ID = ?", "{\"apps\":[]}",
          apps.artifactId());
    });

    final ArtifactVerificationResult result = verificationService.verifyArtifacts("C1", apps.artifactId());

    assertThat(result.ok()).isFalse();
    assertThat(result.items()).singleElement().satisfies(i -> {
      assertThat(i.status()).isEqualTo(ArtifactCheckStatus.MISMATCH);
      assertThat(i.message()).isEqualTo("record_hash mismatch");
    });
  }

  @Test
  void verifyAuditChain_intact() {
    final int before = component.auditChain().list("C1", 0).size();

    final ChainVerificationResult result = verificationService.verifyAuditChain("C1", 0);

    assertThat(result.ok()).isTrue();
    assertThat(result.total()).isEqualTo(before);
    assertThat(lastEvent().action()).isEqualTo("audit_chain");
    assertThat(lastEvent().chainPrevHash()).isEqualTo(result.lastChainHash());
    assertThat(verificationService.verifyAuditChain("C1", 0).ok()).isTrue();
  }

  @Test
  void verifyAuditChain_rewrittenDetail_flagsThatEventOnly() {
    final List<AuditEvent> events = component.auditChain().list("C1", 0);
    component.jdbi().useHandle(handle -> {
      handle.execute("DROP TRIGGER TRG_AUDIT_EVENT_NO_UPDATE");
      handle.execute("UPDATE AUDIT_EVENT SET DETAIL_JSON = ? WHERE EVENT_ID = ?", "{\"forged\":true}",
          events.get(0).eventId());
    });

    final ChainVerificationResult result = verificationService.verifyAuditChain("C1", 0);

    assertThat(result.ok()).isFalse();
    assertThat(result.failures()).singleElement().satisfies(f -> {
      assertThat(f.index()).isZero();
      assertThat(f.kind()).isEqualTo(ChainFailureKind.CHAIN_HASH);
    });
    assertThat(lastEvent().status()).isEqualTo(AuditStatus.FAILED);
  }

  @Test
  void verifyAuditChain_limitWalksLeadingEvents() {
    final ChainVerificationResult result = verificationService.verifyAuditChain("C1", 1);

    assertThat(result.total()).isEqualTo(1);
    assertThat(result.ok()).isTrue();
  }
}
