package io.github.cryptoinspector.manager;

import io.github.cryptoinspector.dao.CaseDao;
import io.github.cryptoinspector.exception.NotFoundException;
import io.github.cryptoinspector.model.CaseOverview;
import io.github.cryptoinspector.model.CaseRecord;
import io.github.cryptoinspector.model.CaseStatus;
import io.github.cryptoinspector.model.ImmutableCaseRecord;
import java.time.Clock;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates cases on first use and reads their overview.
 */
@Singleton
public class CaseManager {

  private static final Logger log = LoggerFactory.getLogger(CaseManager.class);
  private static final String DEFAULT_TITLE = "Case";

  private final CaseDao caseDao;
  private final Clock clock;

  /**
   * Instantiates a new Case manager.
   *
   * @param caseDao the case dao
   * @param clock   the clock
   */
  @Inject
  public CaseManager(final CaseDao caseDao, final Clock clock) {
    log.info("CaseManager({})", caseDao);
    this.caseDao = caseDao;
    this.clock = clock;
  }

  /**
   * Make sure the case exists, creating an open case with default details if not.
   *
   * @param caseId the case id
   * @return the case
   */
  public CaseRecord ensureCase(final String caseId) {
    return ensureCase(caseId, null, null, null, null);
  }

  /**
   * Make sure the case exists. An existing case keeps its details except where a non blank
   * case number, title or note is given.
   *
   * @param caseId    the case id
   * @param caseNo    the case number, optional
   * @param title     the title, optional
   * @param createdBy the operator creating the case, optional
   * @param note      the note, optional
   * @return the case as stored
   */
  public CaseRecord ensureCase(final String caseId,
                               final String caseNo,
                               final String title,
                               final String createdBy,
                               final String note) {
    requireId(caseId);
    final Optional<CaseRecord> existing = caseDao.find(caseId);
    if (existing.isPresent()) {
      return refresh(existing.get(), caseNo, title, note);
    }
    final long now = clock.millis();
    final CaseRecord record = ImmutableCaseRecord.builder()
        .caseId(caseId)
        .caseNo(Optional.ofNullable(blankToNull(caseNo)))
        .title(isBlank(title) ? DEFAULT_TITLE : title)
        .status(CaseStatus.OPEN)
        .createdBy(isBlank(createdBy) ? "" : createdBy)
        .note(isBlank(note) ? "" : note)
        .createdAt(now)
        .updatedAt(now)
        .build();
    try {
      caseDao.insert(record);
      log.info("ensureCase({}): created", caseId);
      return record;
    } catch (JdbiException e) {
      // Another writer may have created it between the read and the insert.
      return caseDao.find(caseId).orElseThrow(() -> e);
    }
  }

  /**
   * Case row plus record counts.
   *
   * @param caseId the case id
   * @return the overview
   */
  public CaseOverview overview(final String caseId) {
    return caseDao.overview(caseId)
        .orElseThrow(() -> new NotFoundException("case not found: " + caseId));
  }

  /**
   * Find a case.
   *
   * @param caseId the case id
   * @return the case, if present
   */
  public Optional<CaseRecord> find(final String caseId) {
    return caseDao.find(caseId);
  }

  private CaseRecord refresh(final CaseRecord existing,
                             final String caseNo,
                             final String title,
                             final String note) {
    if (isBlank(caseNo) && isBlank(title) && isBlank(note)) {
      return existing;
    }
    final CaseRecord updated = ImmutableCaseRecord.copyOf(existing)
        .withCaseNo(isBlank(caseNo) ? existing.caseNo() : Optional.of(caseNo))
        .withTitle(isBlank(title) ? existing.title() : title)
        .withNote(isBlank(note) ? existing.note() : note)
        .withUpdatedAt(clock.millis());
    caseDao.updateDetails(updated.caseId(), updated.caseNo().orElse(null), updated.title(), updated.note(),
        updated.updatedAt());
    return updated;
  }

  /**
   * Rejects a null or blank case id.
   *
   * @param id the case id
   */
  public static void requireId(final String id) {
    if (isBlank(id)) {
      throw new IllegalArgumentException("case id is required");
    }
  }

  public static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }

  private static String blankToNull(final String value) {
    return isBlank(value) ? null : value;
  }
}
