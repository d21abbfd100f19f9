package io.github.cryptoinspector.dao;

import io.github.cryptoinspector.model.PrecheckResult;
import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public interface PrecheckDao {

  @SqlUpdate("insert into PRECHECK_RESULT (CHECK_ID, CASE_ID, DEVICE_ID, SCAN_SCOPE, CHECK_CODE, CHECK_NAME, "
      + "REQUIRED, STATUS, MESSAGE, DETAIL_JSON, CHECKED_AT, RECORD_HASH) values (:checkId, :caseId, :deviceId, "
      + ":scanScope, :checkCode, :checkName, :required, :status, :message, :detailJson, :checkedAt, :recordHash)")
  void insert(@BindPojo PrecheckResult result);

  @SqlQuery("select * from PRECHECK_RESULT where CASE_ID = :caseId order by CHECKED_AT, CHECK_ID")
  List<PrecheckResult> listByCase(@Bind("caseId") String caseId);
}
