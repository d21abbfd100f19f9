package io.github.cryptoinspector.verify;

import io.github.cryptoinspector.exception.NotFoundException;
import io.github.cryptoinspector.helper.HashHelper;
import io.github.cryptoinspector.manager.ArtifactStore;
import io.github.cryptoinspector.manager.AuditChain;
import io.github.cryptoinspector.manager.CaseManager;
import io.github.cryptoinspector.model.Artifact;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.AuditStatus;
import io.github.cryptoinspector.model.Configuration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-derives hashes from the artifact store and the audit chain and reports every discrepancy.
 * Each run records its own summary event on the case's chain.
 */
@Singleton
public class VerificationService {

  private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

  private final CaseManager caseManager;
  private final ArtifactStore artifactStore;
  private final AuditChain auditChain;
  private final AuditChainVerifier auditChainVerifier;
  private final HashHelper hashHelper;
  private final Configuration configuration;

  /**
   * Instantiates a new Verification service.
   *
   * @param caseManager        the case manager
   * @param artifactStore      the artifact store
   * @param auditChain         the audit chain
   * @param auditChainVerifier the audit chain verifier
   * @param hashHelper         the hash helper
   * @param configuration      the configuration
   */
  @Inject
  public VerificationService(final CaseManager caseManager,
                             final ArtifactStore artifactStore,
                             final AuditChain auditChain,
                             final AuditChainVerifier auditChainVerifier,
                             final HashHelper hashHelper,
                             final Configuration configuration) {
    this.caseManager = caseManager;
    this.artifactStore = artifactStore;
    this.auditChain = auditChain;
    this.auditChainVerifier = auditChainVerifier;
    this.hashHelper = hashHelper;
    this.configuration = configuration;
  }

  /**
   * Verify every artifact of a case.
   *
   * @param caseId the case id
   * @return the result
   */
  public ArtifactVerificationResult verifyArtifacts(final String caseId) {
    return verifyArtifacts(caseId, null);
  }

  /**
   * Verify the artifacts of a case, or one of them.
   *
   * @param caseId     the case id
   * @param artifactId a single artifact to verify, or null for all
   * @return the result
   * @throws NotFoundException if the case, or the named artifact within it, does not exist
   */
  public ArtifactVerificationResult verifyArtifacts(final String caseId, final String artifactId) {
    requireCase(caseId);
    final List<Artifact> artifacts;
    if (CaseManager.isBlank(artifactId)) {
      artifacts = artifactStore.listByCase(caseId);
    } else {
      final Optional<Artifact> artifact = artifactStore.get(artifactId).filter(a -> a.caseId().equals(caseId));
      if (artifact.isEmpty()) {
        auditChain.append(caseId, null, "verify", "artifacts", AuditStatus.FAILED, configuration.defaultOperator(),
            "VerificationService.verifyArtifacts", Map.of("artifact_id", artifactId, "error", "not found"));
        throw new NotFoundException("artifact " + artifactId + " not found in case " + caseId);
      }
      artifacts = List.of(artifact.get());
    }

    final List<ArtifactCheck> items = new ArrayList<>(artifacts.size());
    int okCount = 0;
    int mismatch = 0;
    int missing = 0;
    int error = 0;
    for (Artifact artifact : artifacts) {
      final ArtifactCheck check = check(artifact);
      switch (check.status()) {
        case OK:
          okCount++;
          break;
        case MISMATCH:
          mismatch++;
          break;
        case MISSING:
          missing++;
          break;
        default:
          error++;
          break;
      }
      items.add(check);
    }
    final ArtifactVerificationResult result = ImmutableArtifactVerificationResult.builder()
        .caseId(caseId)
        .ok(mismatch == 0 && missing == 0 && error == 0)
        .okCount(okCount)
        .mismatchCount(mismatch)
        .missingCount(missing)
        .errorCount(error)
        .items(items)
        .build();

    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("total", items.size());
    detail.put("ok", okCount);
    detail.put("mismatch", mismatch);
    detail.put("missing", missing);
    detail.put("error", error);
    if (!CaseManager.isBlank(artifactId)) {
      detail.put("artifact_id", artifactId);
    }
    auditChain.append(caseId, null, "verify", "artifacts", result.ok() ? AuditStatus.SUCCESS : AuditStatus.FAILED,
        configuration.defaultOperator(), "VerificationService.verifyArtifacts", detail);
    log.info("verifyArtifacts({}): ok={} total={} mismatch={} missing={} error={}",
        caseId, result.ok(), items.size(), mismatch, missing, error);
    return result;
  }

  /**
   * Walk a case's audit chain.
   *
   * @param caseId the case id
   * @param limit  the number of leading events to walk; zero or less walks all of them
   * @return the result
   */
  public ChainVerificationResult verifyAuditChain(final String caseId, final int limit) {
    requireCase(caseId);
    final List<AuditEvent> events = auditChain.list(caseId, limit);
    final ChainVerificationResult result = auditChainVerifier.verify(events);

    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("total", result.total());
    detail.put("failed", result.failed());
    detail.put("prev_hash_failed", result.prevHashFailed());
    detail.put("chain_hash_failed", result.chainHashFailed());
    detail.put("limit", limit);
    detail.put("last_chain_hash", result.lastChainHash());
    auditChain.append(caseId, null, "verify", "audit_chain", result.ok() ? AuditStatus.SUCCESS : AuditStatus.FAILED,
        configuration.defaultOperator(), "VerificationService.verifyAuditChain", detail);
    log.info("verifyAuditChain({}): ok={} total={} failed={}", caseId, result.ok(), result.total(), result.failed());
    return result;
  }

  private void requireCase(final String caseId) {
    CaseManager.requireId(caseId);
    if (caseManager.find(caseId).isEmpty()) {
      throw new NotFoundException("case not found: " + caseId);
    }
  }

  private ArtifactCheck check(final Artifact artifact) {
    final ImmutableArtifactCheck.Builder builder = ImmutableArtifactCheck.builder()
        .artifactId(artifact.artifactId())
        .snapshotPath(artifact.snapshotPath())
        .expectedSha256(artifact.sha256())
        .expectedSize(artifact.sizeBytes());
    final Path path = Path.of(artifact.snapshotPath());
    if (!Files.exists(path)) {
      return builder.status(ArtifactCheckStatus.MISSING).message("snapshot file not found").build();
    }
    final HashHelper.FileDigest digest;
    try {
      digest = hashHelper.file(path);
    } catch (IOException e) {
      log.warn("check({}): unreadable {}", artifact.artifactId(), path, e);
      return builder.status(ArtifactCheckStatus.ERROR).message("read failed: " + e.getMessage()).build();
    }
    builder.actualSha256(digest.sha256()).actualSize(digest.sizeBytes());
    if (!digest.sha256().equals(artifact.sha256())) {
      return builder.status(ArtifactCheckStatus.MISMATCH).message("sha256 mismatch").build();
    }
    if (digest.sizeBytes() != artifact.sizeBytes()) {
      return builder.status(ArtifactCheckStatus.MISMATCH).message("size mismatch").build();
    }
    if (!artifactStore.recordHashOf(artifact).equals(artifact.recordHash())) {
      return builder.status(ArtifactCheckStatus.MISMATCH).message("record_hash mismatch").build();
    }
    return builder.status(ArtifactCheckStatus.OK).message("").build();
  }
}
