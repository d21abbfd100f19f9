package io.github.cryptoinspector.dao;

import io.github.cryptoinspector.model.CaseOverview;
import io.github.cryptoinspector.model.CaseRecord;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Case rows. Cases are never deleted.
 */
public interface CaseDao {

  @SqlUpdate("insert into INSPECTION_CASE (CASE_ID, CASE_NO, TITLE, STATUS, CREATED_BY, NOTE, CREATED_AT, UPDATED_AT) "
      + "values (:caseId, :caseNo, :title, :status, :createdBy, :note, :createdAt, :updatedAt)")
  void insert(@BindPojo CaseRecord caseRecord);

  @SqlQuery("select * from INSPECTION_CASE where CASE_ID = :caseId")
  Optional<CaseRecord> find(@Bind("caseId") String caseId);

  /**
   * Overwrite the descriptive fields of a case.
   *
   * @param caseId    the case id
   * @param caseNo    the case number
   * @param title     the title
   * @param note      the note
   * @param updatedAt the update time
   * @return the number of rows changed
   */
  @SqlUpdate("update INSPECTION_CASE set CASE_NO = :caseNo, TITLE = :title, NOTE = :note, UPDATED_AT = :updatedAt "
      + "where CASE_ID = :caseId")
  int updateDetails(@Bind("caseId") String caseId,
                    @Bind("caseNo") String caseNo,
                    @Bind("title") String title,
                    @Bind("note") String note,
                    @Bind("updatedAt") long updatedAt);

  @SqlQuery("select c.*, "
      + "(select count(*) from CASE_DEVICE d where d.CASE_ID = c.CASE_ID) as DEVICE_COUNT, "
      + "(select count(*) from ARTIFACT a where a.CASE_ID = c.CASE_ID) as ARTIFACT_COUNT, "
      + "(select count(*) from RULE_HIT h where h.CASE_ID = c.CASE_ID) as HIT_COUNT, "
      + "(select count(*) from REPORT r where r.CASE_ID = c.CASE_ID) as REPORT_COUNT "
      + "from INSPECTION_CASE c where c.CASE_ID = :caseId")
  Optional<CaseOverview> overview(@Bind("caseId") String caseId);
}
