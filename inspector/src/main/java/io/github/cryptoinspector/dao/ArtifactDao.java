package io.github.cryptoinspector.dao;

import io.github.cryptoinspector.model.Artifact;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Artifact metadata. Insert and read only; the table carries triggers rejecting update and
 * delete.
 */
public interface ArtifactDao {

  @SqlUpdate("insert into ARTIFACT (ARTIFACT_ID, CASE_ID, DEVICE_ID, ARTIFACT_TYPE, SOURCE_REF, SNAPSHOT_PATH, "
      + "SHA256, SIZE_BYTES, COLLECTED_AT, COLLECTOR_NAME, COLLECTOR_VERSION, ACQUISITION_METHOD, PAYLOAD_JSON, "
      + "RECORD_HASH) values (:artifactId, :caseId, :deviceId, :artifactType, :sourceRef, :snapshotPath, :sha256, "
      + ":sizeBytes, :collectedAt, :collectorName, :collectorVersion, :acquisitionMethod, :payloadJson, :recordHash)")
  void insert(@BindPojo Artifact artifact);

  @SqlQuery("select * from ARTIFACT where ARTIFACT_ID = :artifactId")
  Optional<Artifact> find(@Bind("artifactId") String artifactId);

  @SqlQuery("select * from ARTIFACT where CASE_ID = :caseId order by COLLECTED_AT, ARTIFACT_ID")
  List<Artifact> listByCase(@Bind("caseId") String caseId);
}
