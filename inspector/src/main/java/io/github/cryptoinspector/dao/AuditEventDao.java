package io.github.cryptoinspector.dao;

import io.github.cryptoinspector.model.AuditEvent;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Audit chain rows. Insert and read only.
 */
public interface AuditEventDao {

  @SqlUpdate("insert into AUDIT_EVENT (EVENT_ID, CASE_ID, DEVICE_ID, EVENT_TYPE, ACTION, STATUS, ACTOR, SOURCE, "
      + "DETAIL_JSON, OCCURRED_AT, CHAIN_PREV_HASH, CHAIN_HASH) values (:eventId, :caseId, :deviceId, :eventType, "
      + ":action, :status, :actor, :source, :detailJson, :occurredAt, :chainPrevHash, :chainHash)")
  void insert(@BindPojo AuditEvent event);

  /**
   * The most recent event of a case.
   *
   * @param caseId the case id
   * @return the tail, if the case has events
   */
  @SqlQuery("select * from AUDIT_EVENT where CASE_ID = :caseId order by OCCURRED_AT desc, EVENT_ID desc limit 1")
  Optional<AuditEvent> tail(@Bind("caseId") String caseId);

  @SqlQuery("select * from AUDIT_EVENT where CASE_ID = :caseId order by OCCURRED_AT, EVENT_ID")
  List<AuditEvent> listAll(@Bind("caseId") String caseId);

  @SqlQuery("select * from AUDIT_EVENT where CASE_ID = :caseId order by OCCURRED_AT, EVENT_ID limit :limit")
  List<AuditEvent> list(@Bind("caseId") String caseId, @Bind("limit") int limit);
}
