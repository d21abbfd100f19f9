package io.github.cryptoinspector.dao;

import io.github.cryptoinspector.model.CaseDevice;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Devices registered against a case.
 */
public interface CaseDeviceDao {

  @SqlUpdate("insert into CASE_DEVICE (DEVICE_ID, CASE_ID, OS_TYPE, DEVICE_NAME, IDENTIFIER, CONNECTION_TYPE, "
      + "AUTHORIZED, AUTH_NOTE, FIRST_SEEN_AT, LAST_SEEN_AT) values (:deviceId, :caseId, :osType, :deviceName, "
      + ":identifier, :connectionType, :authorized, :authNote, :firstSeenAt, :lastSeenAt)")
  void insert(@BindPojo CaseDevice device);

  @SqlQuery("select * from CASE_DEVICE where DEVICE_ID = :deviceId")
  Optional<CaseDevice> find(@Bind("deviceId") String deviceId);

  /**
   * Refresh the mutable attributes of a device seen again.
   *
   * @param device the device
   * @return the rows changed
   */
  @SqlUpdate("update CASE_DEVICE set DEVICE_NAME = :deviceName, CONNECTION_TYPE = :connectionType, "
      + "AUTHORIZED = :authorized, AUTH_NOTE = :authNote, LAST_SEEN_AT = :lastSeenAt "
      + "where DEVICE_ID = :deviceId and CASE_ID = :caseId")
  int touch(@BindPojo CaseDevice device);

  @SqlQuery("select * from CASE_DEVICE where CASE_ID = :caseId order by FIRST_SEEN_AT, DEVICE_ID")
  List<CaseDevice> listByCase(@Bind("caseId") String caseId);
}
