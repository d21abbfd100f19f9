package io.github.cryptoinspector.dao;

import io.github.cryptoinspector.model.Report;
import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public interface ReportDao {

  @SqlUpdate("insert into REPORT (REPORT_ID, CASE_ID, REPORT_TYPE, FILE_PATH, SHA256, GENERATED_AT, "
      + "GENERATOR_VERSION, STATUS) values (:reportId, :caseId, :reportType, :filePath, :sha256, :generatedAt, "
      + ":generatorVersion, :status)")
  void insert(@BindPojo Report report);

  @SqlQuery("select * from REPORT where CASE_ID = :caseId order by GENERATED_AT, REPORT_ID")
  List<Report> listByCase(@Bind("caseId") String caseId);
}
