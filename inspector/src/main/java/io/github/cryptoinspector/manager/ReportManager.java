package io.github.cryptoinspector.manager;

import io.github.cryptoinspector.dao.ReportDao;
import io.github.cryptoinspector.helper.IdGenerator;
import io.github.cryptoinspector.model.ImmutableReport;
import io.github.cryptoinspector.model.Report;
import io.github.cryptoinspector.model.ReportStatus;
import io.github.cryptoinspector.model.ReportType;
import java.time.Clock;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Index of generated report files.
 */
@Singleton
public class ReportManager {

  private static final Logger log = LoggerFactory.getLogger(ReportManager.class);

  private final ReportDao reportDao;
  private final CaseManager caseManager;
  private final IdGenerator idGenerator;
  private final Clock clock;

  @Inject
  public ReportManager(final ReportDao reportDao,
                       final CaseManager caseManager,
                       final IdGenerator idGenerator,
                       final Clock clock) {
    this.reportDao = reportDao;
    this.caseManager = caseManager;
    this.idGenerator = idGenerator;
    this.clock = clock;
  }

  /**
   * Register a report file.
   *
   * @param caseId           the case id
   * @param type             the report type
   * @param filePath         the file path
   * @param sha256           the file hash
   * @param generatorVersion the generator version
   * @param status           the status
   * @return the registered report
   */
  public Report saveReport(final String caseId,
                           final ReportType type,
                           final String filePath,
                           final String sha256,
                           final String generatorVersion,
                           final ReportStatus status) {
    caseManager.ensureCase(caseId);
    final Report report = ImmutableReport.builder()
        .reportId(idGenerator.newId("report"))
        .caseId(caseId)
        .reportType(type)
        .filePath(filePath)
        .sha256(sha256)
        .generatedAt(clock.millis())
        .generatorVersion(generatorVersion)
        .status(status)
        .build();
    reportDao.insert(report);
    log.info("saveReport({}, {}): {}", caseId, type.value(), report.reportId());
    return report;
  }

  public List<Report> listByCase(final String caseId) {
    return reportDao.listByCase(caseId);
  }
}
