package io.github.cryptoinspector.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cryptoinspector.helper.HashHelper;
import io.github.cryptoinspector.manager.ArtifactStore;
import io.github.cryptoinspector.manager.AuditChain;
import io.github.cryptoinspector.manager.CaseManager;
import io.github.cryptoinspector.manager.DeviceManager;
import io.github.cryptoinspector.manager.PrecheckManager;
import io.github.cryptoinspector.manager.ReportManager;
import io.github.cryptoinspector.manager.RuleHitManager;
import io.github.cryptoinspector.model.Artifact;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.AuditStatus;
import io.github.cryptoinspector.model.CaseDevice;
import io.github.cryptoinspector.model.CaseOverview;
import io.github.cryptoinspector.model.Configuration;
import io.github.cryptoinspector.model.PrecheckResult;
import io.github.cryptoinspector.model.Report;
import io.github.cryptoinspector.model.ReportStatus;
import io.github.cryptoinspector.model.ReportType;
import io.github.cryptoinspector.model.RuleHit;
import io.github.cryptoinspector.verify.OfflineVerifier;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipOutputStream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a self contained forensic package for a case.
 *
 * <p>The archive holds {@code manifest.json}, {@code hashes.sha256} and copies of the case's
 * snapshot, report and rule files under {@code evidence/}, {@code reports/} and {@code rules/}.
 * Each file is hashed in the same pass that writes it into the archive. Files that cannot be
 * opened become warnings instead of failing the export.
 *
 * <p>The export can be cancelled by interrupting the calling thread. The interrupt is checked
 * before each file; once seen, remaining files are skipped with a warning, the manifest and
 * digest list are still written, the package is registered as failed and the interrupt status
 * is restored before returning.
 */
@Singleton
public class ForensicExporter {

  /**
   * Generator version recorded on the report row.
   */
  public static final String GENERATOR_VERSION = "forensic-exportzip-0.1.0";

  private static final Logger log = LoggerFactory.getLogger(ForensicExporter.class);
  private static final int BUFFER_SIZE = 64 * 1024;
  private static final String SOURCE = "ForensicExporter.generateForensicZip";

  private final CaseManager caseManager;
  private final DeviceManager deviceManager;
  private final ArtifactStore artifactStore;
  private final RuleHitManager ruleHitManager;
  private final PrecheckManager precheckManager;
  private final ReportManager reportManager;
  private final AuditChain auditChain;
  private final HashHelper hashHelper;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Configuration configuration;

  /**
   * Instantiates a new Forensic exporter.
   *
   * @param caseManager     the case manager
   * @param deviceManager   the device manager
   * @param artifactStore   the artifact store
   * @param ruleHitManager  the rule hit manager
   * @param precheckManager the precheck manager
   * @param reportManager   the report manager
   * @param auditChain      the audit chain
   * @param hashHelper      the hash helper
   * @param objectMapper    the object mapper
   * @param clock           the clock
   * @param configuration   the configuration
   */
  @Inject
  public ForensicExporter(final CaseManager caseManager,
                          final DeviceManager deviceManager,
                          final ArtifactStore artifactStore,
                          final RuleHitManager ruleHitManager,
                          final PrecheckManager precheckManager,
                          final ReportManager reportManager,
                          final AuditChain auditChain,
                          final HashHelper hashHelper,
                          final ObjectMapper objectMapper,
                          final Clock clock,
                          final Configuration configuration) {
    log.info("ForensicExporter({})", configuration.exportDir());
    this.caseManager = caseManager;
    this.deviceManager = deviceManager;
    this.artifactStore = artifactStore;
    this.ruleHitManager = ruleHitManager;
    this.precheckManager = precheckManager;
    this.reportManager = reportManager;
    this.auditChain = auditChain;
    this.hashHelper = hashHelper;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.configuration = configuration;
  }

  /**
   * Export a case.
   *
   * @param caseId  the case id
   * @param options the options
   * @return the result
   * @throws IOException if the archive cannot be created or written
   */
  public ExportResult generateForensicZip(final String caseId, final ExportOptions options) throws IOException {
    CaseManager.requireId(caseId);
    final long startedAt = clock.millis();
    final CaseOverview overview = caseManager.overview(caseId);
    final List<CaseDevice> devices = deviceManager.listByCase(caseId);
    final List<Artifact> artifacts = artifactStore.listByCase(caseId);
    final List<RuleHit> hits = ruleHitManager.listHitDetails(caseId);
    final List<PrecheckResult> prechecks = precheckManager.listByCase(caseId);
    final List<AuditEvent> audits = auditChain.list(caseId, 0);
    final List<Report> reports = reportManager.listByCase(caseId);
    log.info("generateForensicZip({}): {} artifacts, {} reports, {} audits",
        caseId, artifacts.size(), reports.size(), audits.size());

    final List<String> warnings = new ArrayList<>();
    final List<Include> includes = new ArrayList<>();

    final Path evidenceRoot = absolute(configuration.evidenceRoot());
    final List<ManifestArtifact> manifestArtifacts = new ArrayList<>(artifacts.size());
    for (Artifact artifact : artifacts) {
      final Path source = absolute(Path.of(artifact.snapshotPath()));
      final String rel = relativeOrNull(evidenceRoot, source);
      // Snapshots outside the root keep their artifact id in the name so two of them never share an entry.
      final String zipPath = "evidence/" + (rel != null
          ? rel
          : ArtifactStore.sanitize(artifact.deviceId()) + "/" + ArtifactStore.sanitize(artifact.artifactId())
              + "_" + source.getFileName());
      includes.add(new Include(source, zipPath, FileKind.ARTIFACT, artifact));
      manifestArtifacts.add(ImmutableManifestArtifact.builder().artifact(artifact).zipPath(zipPath).build());
    }

    final Path reportsRoot = absolute(configuration.reportsRoot());
    final List<ManifestReport> manifestReports = new ArrayList<>();
    for (Report report : reports) {
      if (report.reportType() == ReportType.FORENSIC_ZIP || report.filePath().isBlank()) {
        continue;
      }
      final Path source = absolute(Path.of(report.filePath()));
      final String rel = relativeOrNull(reportsRoot, source);
      final String zipPath = "reports/" + (rel != null
          ? rel
          : ArtifactStore.sanitize(report.reportId()) + "_" + source.getFileName());
      includes.add(new Include(source, zipPath, FileKind.REPORT, null));
      manifestReports.add(ImmutableManifestReport.builder().report(report).zipPath(zipPath).build());
    }

    final List<Path> ruleFiles = options.ruleFiles().isEmpty() ? configuration.ruleFiles() : options.ruleFiles();
    for (Path rule : ruleFiles) {
      includes.add(new Include(absolute(rule), "rules/" + rule.getFileName(), FileKind.RULE, null));
    }

    final Path exportDir = options.exportDir().orElse(configuration.exportDir());
    Files.createDirectories(exportDir);
    final Path zipFile = freeName(exportDir, ArtifactStore.sanitize(caseId) + "_forensic_export_"
        + (startedAt / 1000L));

    boolean cancelled = false;
    try {
      final List<ManifestFileEntry> files = new ArrayList<>();
      try (ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(new FileOutputStream(zipFile.toFile())))) {
        for (Include include : includes) {
          // Cleared once seen so the remaining file and database work runs undisturbed.
          if (!cancelled && Thread.interrupted()) {
            cancelled = true;
            log.warn("generateForensicZip({}): cancelled", caseId);
          }
          if (cancelled) {
            warnings.add("export cancelled: skipped " + include.source);
            continue;
          }
          addDiskFile(zip, include, warnings).ifPresent(files::add);
        }
        if (!cancelled && Thread.interrupted()) {
          cancelled = true;
          log.warn("generateForensicZip({}): cancelled after last file", caseId);
        }
        files.sort(Comparator.comparing(ManifestFileEntry::path));

        final ForensicManifest manifest = ImmutableForensicManifest.builder()
            .schema(ForensicManifest.SCHEMA_V1)
            .generatedAt(clock.millis())
            .app(configuration.appInfo())
            .caseOverview(overview)
            .devices(devices)
            .artifacts(manifestArtifacts)
            .hits(hits)
            .prechecks(prechecks)
            .audits(audits)
            .reports(manifestReports)
            .files(files)
            .warnings(warnings)
            .note(options.note().trim())
            .extra(extra(evidenceRoot, cancelled))
            .stats(stats(devices, artifacts, hits, prechecks, audits, reports))
            .build();
        final byte[] manifestBytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest);
        final List<ManifestFileEntry> listed = new ArrayList<>(files);
        listed.add(addBytes(zip, OfflineVerifier.MANIFEST_ENTRY, manifestBytes, FileKind.MANIFEST));
        listed.sort(Comparator.comparing(ManifestFileEntry::path));
        addBytes(zip, OfflineVerifier.HASHES_ENTRY, hashList(listed), FileKind.MANIFEST);
      } catch (IOException e) {
        log.error("generateForensicZip({}): writing {} failed", caseId, zipFile, e);
        Files.deleteIfExists(zipFile);
        throw e;
      }

      final String zipSha256 = hashHelper.file(zipFile).sha256();
      final Report report = reportManager.saveReport(caseId, ReportType.FORENSIC_ZIP, zipFile.toString(), zipSha256,
          GENERATOR_VERSION, cancelled ? ReportStatus.FAILED : ReportStatus.READY);

      final Map<String, Object> detail = new LinkedHashMap<>();
      detail.put("zip_path", zipFile.toString());
      detail.put("zip_sha256", zipSha256);
      detail.put("warnings", warnings);
      detail.put("report_id", report.reportId());
      if (cancelled) {
        detail.put("cancelled", true);
      }
      auditChain.append(caseId, null, "export", "forensic_zip", cancelled ? AuditStatus.FAILED : AuditStatus.SUCCESS,
          options.operator().filter(o -> !o.isBlank()).orElse(configuration.defaultOperator()), SOURCE, detail);

      log.info("generateForensicZip({}): {} sha256={} warnings={} cancelled={}",
          caseId, zipFile, zipSha256, warnings.size(), cancelled);
      return ImmutableExportResult.builder()
          .caseId(caseId)
          .reportId(report.reportId())
          .zipPath(zipFile.toString())
          .zipSha256(zipSha256)
          .warnings(warnings)
          .cancelled(cancelled)
          .startedAt(startedAt)
          .finishedAt(clock.millis())
          .build();
    } finally {
      if (cancelled) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Stream a file into the archive, hashing it on the way. The source is opened before the
   * archive entry so an unreadable file leaves no trace in the archive.
   */
  private Optional<ManifestFileEntry> addDiskFile(final ZipOutputStream zip,
                                                            final Include include,
                                                            final List<String> warnings) throws IOException {
    final File file = include.source.toFile();
    if (!file.isFile()) {
      warnings.add("skip file " + include.source + " -> " + include.zipPath + ": "
          + (file.exists() ? "not a regular file" : "not found"));
      return Optional.empty();
    }
    final InputStream in;
    try {
      in = new FileInputStream(file);
    } catch (IOException e) {
      warnings.add("skip file " + include.source + " -> " + include.zipPath + ": " + e.getMessage());
      return Optional.empty();
    }
    try (InputStream source = in) {
      try {
        zip.putNextEntry(new ZipEntry(include.zipPath));
      } catch (ZipException e) {
        warnings.add("skip file " + include.source + " -> " + include.zipPath + ": " + e.getMessage());
        return Optional.empty();
      }
      final MessageDigest digest = hashHelper.newDigest();
      final byte[] buffer = new byte[BUFFER_SIZE];
      long size = 0;
      int read;
      while ((read = source.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
        zip.write(buffer, 0, read);
        size += read;
      }
      zip.closeEntry();
      final String sha256 = hashHelper.hex(digest);
      if (include.artifact != null && !sha256.equals(include.artifact.sha256())) {
        warnings.add("artifact " + include.artifact.artifactId() + " snapshot sha256 differs from its record");
      }
      return Optional.of(ImmutableManifestFileEntry.builder()
          .path(include.zipPath)
          .sha256(sha256)
          .sizeBytes(size)
          .kind(include.kind)
          .build());
    }
  }

  private ManifestFileEntry addBytes(final ZipOutputStream zip,
                                     final String zipPath,
                                     final byte[] bytes,
                                     final FileKind kind) throws IOException {
    zip.putNextEntry(new ZipEntry(zipPath));
    zip.write(bytes);
    zip.closeEntry();
    final HashHelper.FileDigest digest = hashHelper.bytes(bytes);
    return ImmutableManifestFileEntry.builder()
        .path(zipPath)
        .sha256(digest.sha256())
        .sizeBytes(digest.sizeBytes())
        .kind(kind)
        .build();
  }

  private byte[] hashList(final List<ManifestFileEntry> entries) {
    final StringBuilder sb = new StringBuilder()
        .append("# crypto-inspector forensic export hash list\n")
        .append("# generated_at=").append(clock.millis()).append('\n')
        .append("# format: <sha256><two spaces><path>\n");
    for (ManifestFileEntry entry : entries) {
      sb.append(entry.sha256()).append("  ").append(entry.path()).append('\n');
    }
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static Map<String, Object> extra(final Path evidenceRoot, final boolean cancelled) {
    final Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("evidence_root", evidenceRoot.toString());
    extra.put("cancelled", cancelled);
    return extra;
  }

  private static Map<String, Long> stats(final List<CaseDevice> devices,
                                         final List<Artifact> artifacts,
                                         final List<RuleHit> hits,
                                         final List<PrecheckResult> prechecks,
                                         final List<AuditEvent> audits,
                                         final List<Report> reports) {
    final Map<String, Long> stats = new LinkedHashMap<>();
    stats.put("device_count", (long) devices.size());
    stats.put("artifact_count", (long) artifacts.size());
    stats.put("hit_count", (long) hits.size());
    stats.put("precheck_count", (long) prechecks.size());
    stats.put("audit_count", (long) audits.size());
    stats.put("report_count", (long) reports.size());
    return stats;
  }

  private static Path absolute(final Path path) {
    return path.toAbsolutePath().normalize();
  }

  /**
   * Path of {@code target} under {@code base} joined with {@code /}, or null when it is not
   * strictly inside it.
   */
  static String relativeOrNull(final Path base, final Path target) {
    if (!target.startsWith(base) || target.equals(base)) {
      return null;
    }
    final Path rel = base.relativize(target);
    final List<String> names = new ArrayList<>();
    for (Path name : rel) {
      final String part = name.toString();
      if (part.isEmpty() || part.equals(".") || part.equals("..")) {
        return null;
      }
      names.add(part);
    }
    return String.join("/", names);
  }

  private static Path freeName(final Path dir, final String baseName) {
    Path candidate = dir.resolve(baseName + ".zip");
    for (int n = 1; Files.exists(candidate); n++) {
      candidate = dir.resolve(baseName + "_" + n + ".zip");
    }
    return candidate.toAbsolutePath().normalize();
  }

  private static final class Include {
    private final Path source;
    private final String zipPath;
    private final FileKind kind;
    private final Artifact artifact;

    private Include(final Path source, final String zipPath, final FileKind kind, final Artifact artifact) {
      this.source = source;
      this.zipPath = zipPath;
      this.kind = kind;
      this.artifact = artifact;
    }
  }
}
