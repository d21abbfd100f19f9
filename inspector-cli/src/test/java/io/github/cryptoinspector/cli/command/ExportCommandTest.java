package io.github.cryptoinspector.cli.command;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.cryptoinspector.model.ArtifactType;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.Report;
import io.github.cryptoinspector.model.ReportStatus;
import io.github.cryptoinspector.model.ReportType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExportCommandTest extends BaseCommandTest {

  @Test
  void forensicZip_writesPackageAndRecordsIt() throws Exception {
    // Given
    component.artifactStore().put("C1", "D1", ArtifactType.BROWSER_HISTORY, "chrome", "scan", Map.of("k", 1));
    final Path rule = Files.writeString(tempDir.resolve("exchanges.yaml"), "rules: []\n");

    // When
    final int exitCode = run("export", "forensic-zip", "--case-id", "C1", "--note", "handover",
        "--operator", "carol", "--rules", rule.toString());

    // Then
    assertThat(exitCode).isZero();
    final Report report = component.reportManager().listByCase("C1").stream()
        .filter(r -> r.reportType() == ReportType.FORENSIC_ZIP)
        .findFirst()
        .orElseThrow();
    assertThat(report.status()).isEqualTo(ReportStatus.READY);
    assertThat(Path.of(report.filePath())).exists().startsWith(configuration.exportDir().toAbsolutePath());
    assertThat(out.toString()).contains("zip: " + report.filePath()).doesNotContain("warning:");

    final AuditEvent audit = component.auditChain().tail("C1").orElseThrow();
    assertThat(audit.actor()).isEqualTo("carol");

    assertThat(runRaw("verify", "forensic-zip", "--zip", report.filePath())).isZero();
  }

  @Test
  void forensicZip_unknownCase_isAUsageError() {
    assertThat(run("export", "forensic-zip", "--case-id", "nope")).isEqualTo(2);
  }
}
