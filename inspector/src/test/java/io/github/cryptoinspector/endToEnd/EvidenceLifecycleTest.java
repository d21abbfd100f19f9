package io.github.cryptoinspector.endToEnd;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.cryptoinspector.export.ExportOptions;
import io.github.cryptoinspector.export.ExportResult;
import io.github.cryptoinspector.model.Artifact;
import io.github.cryptoinspector.model.ArtifactType;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.AuditStatus;
import io.github.cryptoinspector.verify.OfflineVerifier;
import io.github.cryptoinspector.verify.ZipEntryStatus;
import io.github.cryptoinspector.verify.ZipVerificationResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.Test;

/**
 * Collect, export, then verify the package with the case database gone.
 */
class EvidenceLifecycleTest extends BaseEndToEndTest {

  @Test
  void exportedPackage_verifiesWithoutTheDatabase() throws IOException {
    // Given
    final Artifact artifact = component.artifactStore()
        .put("C1", "D1", ArtifactType.INSTALLED_APPS, "registry", "scan", Map.of("k", 1));
    final AuditEvent started = component.auditChain().append("C1", "D1", "collect", "installed_apps",
        AuditStatus.STARTED, "alice", "EvidenceLifecycleTest", Map.of());
    final AuditEvent done = component.auditChain().append("C1", "D1", "collect", "installed_apps",
        AuditStatus.SUCCESS, "alice", "EvidenceLifecycleTest", Map.of("artifact_id", artifact.artifactId()));
    assertThat(done.chainPrevHash()).isEqualTo(started.chainHash());
    assertThat(component.verificationService().verifyArtifacts("C1").ok()).isTrue();
    assertThat(component.verificationService().verifyAuditChain("C1", 0).ok()).isTrue();

    // When
    final ExportResult export = component.forensicExporter().generateForensicZip("C1", ExportOptions.defaults());
    final OfflineVerifier offlineVerifier = component.offlineVerifier();
    shutdownDatabase();
    final ZipVerificationResult result = offlineVerifier.verifyForensicZip(Path.of(export.zipPath()));

    // Then
    assertThat(result.ok()).isTrue();
    assertThat(result.diffs()).isEmpty();
    assertThat(result.auditChain()).hasValueSatisfying(c -> {
      assertThat(c.ok()).isTrue();
      assertThat(c.total()).isEqualTo(4);
    });
  }

  @Test
  void alteredEvidenceInPackage_isReported() throws IOException {
    // Given
    final Artifact artifact = component.artifactStore()
        .put("C1", "D1", ArtifactType.INSTALLED_APPS, "registry", "scan", Map.of("k", 1));
    component.auditChain().append("C1", "D1", "collect", "installed_apps", AuditStatus.SUCCESS, "alice",
        "EvidenceLifecycleTest", Map.of("artifact_id", artifact.artifactId()));
    final ExportResult export = component.forensicExporter().generateForensicZip("C1", ExportOptions.defaults());
    final String evidencePath = "evidence/C1/D1/" + Path.of(artifact.snapshotPath()).getFileName();

    // When
    final Path altered = tempDir.resolve("altered.zip");
    rewrite(Path.of(export.zipPath()), altered, evidencePath, "{\"k\":2}");
    final ZipVerificationResult result = component.offlineVerifier().verifyForensicZip(altered);

    // Then
    assertThat(result.ok()).isFalse();
    assertThat(result.items())
        .filteredOn(i -> i.status() != ZipEntryStatus.OK)
        .singleElement()
        .satisfies(i -> {
          assertThat(i.path()).isEqualTo(evidencePath);
          assertThat(i.status()).isEqualTo(ZipEntryStatus.MISMATCH);
        });
  }

  private static void rewrite(final Path source, final Path target, final String entryName, final String content)
      throws IOException {
    try (ZipFile in = new ZipFile(source.toFile());
         OutputStream file = Files.newOutputStream(target);
         ZipOutputStream out = new ZipOutputStream(file)) {
      final Enumeration<? extends ZipEntry> entries = in.entries();
      while (entries.hasMoreElements()) {
        final ZipEntry entry = entries.nextElement();
        out.putNextEntry(new ZipEntry(entry.getName()));
        if (entry.getName().equals(entryName)) {
          out.write(content.getBytes(StandardCharsets.UTF_8));
        } else {
          try (InputStream data = in.getInputStream(entry)) {
            data.transferTo(out);
          }
        }
        out.closeEntry();
      }
    }
  }
}
