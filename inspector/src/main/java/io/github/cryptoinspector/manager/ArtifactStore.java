package io.github.cryptoinspector.manager;

import io.github.cryptoinspector.dao.ArtifactDao;
import io.github.cryptoinspector.helper.HashHelper;
import io.github.cryptoinspector.helper.IdGenerator;
import io.github.cryptoinspector.helper.JsonHelper;
import io.github.cryptoinspector.model.Artifact;
import io.github.cryptoinspector.model.ArtifactType;
import io.github.cryptoinspector.model.CollectorInfo;
import io.github.cryptoinspector.model.Configuration;
import io.github.cryptoinspector.model.ImmutableArtifact;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes snapshot files and their metadata records.
 *
 * <p>Snapshots land at {@code evidenceRoot/case/device/type_sourceRef_unixSeconds.json}. An
 * existing file is never replaced: a numeric suffix is appended until the name is free. There is
 * no update or delete operation.
 */
@Singleton
public class ArtifactStore {

  /**
   * Collector name recorded when the caller does not identify itself.
   */
  public static final String DEFAULT_COLLECTOR = "inspector";

  private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);
  private static final int MAX_NAME_ATTEMPTS = 10_000;

  private final ArtifactDao artifactDao;
  private final CaseManager caseManager;
  private final HashHelper hashHelper;
  private final JsonHelper jsonHelper;
  private final IdGenerator idGenerator;
  private final Clock clock;
  private final Configuration configuration;

  /**
   * Instantiates a new Artifact store.
   *
   * @param artifactDao   the artifact dao
   * @param caseManager   the case manager
   * @param hashHelper    the hash helper
   * @param jsonHelper    the json helper
   * @param idGenerator   the id generator
   * @param clock         the clock
   * @param configuration the configuration
   */
  @Inject
  public ArtifactStore(final ArtifactDao artifactDao,
                       final CaseManager caseManager,
                       final HashHelper hashHelper,
                       final JsonHelper jsonHelper,
                       final IdGenerator idGenerator,
                       final Clock clock,
                       final Configuration configuration) {
    log.info("ArtifactStore({})", configuration.evidenceRoot());
    this.artifactDao = artifactDao;
    this.caseManager = caseManager;
    this.hashHelper = hashHelper;
    this.jsonHelper = jsonHelper;
    this.idGenerator = idGenerator;
    this.clock = clock;
    this.configuration = configuration;
  }

  /**
   * Store a payload under the default collector identity.
   *
   * @param caseId    the case id
   * @param deviceId  the device id
   * @param type      the artifact type
   * @param sourceRef where on the device the data came from
   * @param method    the acquisition method
   * @param payload   the payload, serializable by Jackson
   * @return the artifact
   * @throws IOException if the snapshot cannot be written
   */
  public Artifact put(final String caseId,
                      final String deviceId,
                      final ArtifactType type,
                      final String sourceRef,
                      final String method,
                      final Object payload) throws IOException {
    return put(caseId, deviceId, type, sourceRef, method, payload,
        CollectorInfo.of(DEFAULT_COLLECTOR, configuration.appInfo().version()));
  }

  /**
   * Store a payload: write the snapshot, hash it, and insert the metadata row.
   *
   * @param caseId    the case id
   * @param deviceId  the device id
   * @param type      the artifact type
   * @param sourceRef where on the device the data came from
   * @param method    the acquisition method
   * @param payload   the payload, serializable by Jackson
   * @param collector the collector
   * @return the artifact
   * @throws IOException if the snapshot cannot be written
   */
  public Artifact put(final String caseId,
                      final String deviceId,
                      final ArtifactType type,
                      final String sourceRef,
                      final String method,
                      final Object payload,
                      final CollectorInfo collector) throws IOException {
    CaseManager.requireId(caseId);
    if (CaseManager.isBlank(deviceId)) {
      throw new IllegalArgumentException("device id is required");
    }
    final byte[] bytes = jsonHelper.snapshot(payload);
    final long collectedAt = clock.millis();

    final Path dir = configuration.evidenceRoot().resolve(sanitize(caseId)).resolve(sanitize(deviceId));
    Files.createDirectories(dir);
    final String baseName = sanitize(type.value()) + "_" + sanitize(sourceRef) + "_" + (collectedAt / 1000L);
    final Path snapshot = writeNew(dir, baseName, bytes).toAbsolutePath().normalize();
    final HashHelper.FileDigest digest = hashHelper.file(snapshot);

    caseManager.ensureCase(caseId);
    final ImmutableArtifact.Builder builder = ImmutableArtifact.builder()
        .artifactId(idGenerator.newId("art"))
        .caseId(caseId)
        .deviceId(deviceId)
        .artifactType(type)
        .sourceRef(sourceRef == null ? "" : sourceRef)
        .snapshotPath(snapshot.toString())
        .sha256(digest.sha256())
        .sizeBytes(digest.sizeBytes())
        .collectedAt(collectedAt)
        .collectorName(collector.name())
        .collectorVersion(collector.version())
        .acquisitionMethod(method == null ? "" : method)
        .payloadJson(new String(bytes, StandardCharsets.UTF_8))
        .recordHash("");
    final Artifact unsigned = builder.build();
    final Artifact artifact = ImmutableArtifact.copyOf(unsigned).withRecordHash(recordHashOf(unsigned));
    artifactDao.insert(artifact);
    log.info("put({}, {}, {}): {} {} bytes", caseId, deviceId, type.value(), artifact.artifactId(),
        artifact.sizeBytes());
    return artifact;
  }

  /**
   * Find an artifact.
   *
   * @param artifactId the artifact id
   * @return the artifact, if present
   */
  public Optional<Artifact> get(final String artifactId) {
    return artifactDao.find(artifactId);
  }

  public List<Artifact> listByCase(final String caseId) {
    return artifactDao.listByCase(caseId);
  }

  /**
   * Recompute the record hash from the artifact's fields, ignoring its stored record hash.
   *
   * @param artifact the artifact
   * @return the hash
   */
  public String recordHashOf(final Artifact artifact) {
    return hashHelper.text(
        artifact.artifactId(),
        artifact.caseId(),
        artifact.deviceId(),
        artifact.artifactType().value(),
        artifact.sourceRef(),
        artifact.snapshotPath(),
        artifact.sha256(),
        Long.toString(artifact.sizeBytes()),
        Long.toString(artifact.collectedAt()),
        artifact.collectorName(),
        artifact.collectorVersion(),
        artifact.acquisitionMethod(),
        artifact.payloadJson());
  }

  /**
   * Replace every character outside {@code [A-Za-z0-9._-]} with an underscore.
   *
   * @param component a file name component
   * @return the safe component
   */
  public static String sanitize(final String component) {
    if (component == null || component.isEmpty()) {
      return "_";
    }
    final String cleaned = component.replaceAll("[^A-Za-z0-9._-]", "_");
    // "." and ".." would escape the directory.
    return cleaned.chars().allMatch(c -> c == '.') ? cleaned.replace('.', '_') : cleaned;
  }

  private Path writeNew(final Path dir, final String baseName, final byte[] bytes) throws IOException {
    for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
      final String name = attempt == 0 ? baseName + ".json" : baseName + "_" + attempt + ".json";
      final Path candidate = dir.resolve(name);
      try {
        Files.write(candidate, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        return candidate;
      } catch (FileAlreadyExistsException e) {
        log.debug("writeNew({}): taken", candidate);
      }
    }
    throw new IOException("no free snapshot name for " + dir.resolve(baseName));
  }
}
