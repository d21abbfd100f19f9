package io.github.cryptoinspector.manager;

import io.github.cryptoinspector.dao.PrecheckDao;
import io.github.cryptoinspector.helper.HashHelper;
import io.github.cryptoinspector.helper.IdGenerator;
import io.github.cryptoinspector.model.ImmutablePrecheckResult;
import io.github.cryptoinspector.model.PrecheckResult;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records precondition checks. Each stored check carries a hash over its fields.
 */
@Singleton
public class PrecheckManager {

  private static final Logger log = LoggerFactory.getLogger(PrecheckManager.class);

  private final Jdbi jdbi;
  private final PrecheckDao precheckDao;
  private final CaseManager caseManager;
  private final HashHelper hashHelper;
  private final IdGenerator idGenerator;
  private final Clock clock;

  @Inject
  public PrecheckManager(final Jdbi jdbi,
                         final PrecheckDao precheckDao,
                         final CaseManager caseManager,
                         final HashHelper hashHelper,
                         final IdGenerator idGenerator,
                         final Clock clock) {
    this.jdbi = jdbi;
    this.precheckDao = precheckDao;
    this.caseManager = caseManager;
    this.hashHelper = hashHelper;
    this.idGenerator = idGenerator;
    this.clock = clock;
  }

  /**
   * Store a batch of checks in one transaction. Blank ids, zero check times and blank record
   * hashes are filled in.
   *
   * @param checks the checks
   * @return the checks as stored
   */
  public List<PrecheckResult> savePrecheckResults(final List<PrecheckResult> checks) {
    if (checks.isEmpty()) {
      return List.of();
    }
    checks.stream().map(PrecheckResult::caseId).distinct().forEach(caseManager::ensureCase);
    final long now = clock.millis();
    final List<PrecheckResult> stored = new ArrayList<>(checks.size());
    for (PrecheckResult check : checks) {
      final ImmutablePrecheckResult filled = ImmutablePrecheckResult.copyOf(check)
          .withCheckId(CaseManager.isBlank(check.checkId()) ? idGenerator.newId("chk") : check.checkId())
          .withCheckedAt(check.checkedAt() > 0 ? check.checkedAt() : now)
          .withDetailJson(CaseManager.isBlank(check.detailJson()) ? "{}" : check.detailJson());
      stored.add(CaseManager.isBlank(filled.recordHash()) ? filled.withRecordHash(recordHashOf(filled)) : filled);
    }
    jdbi.useTransaction(handle -> {
      final PrecheckDao dao = handle.attach(PrecheckDao.class);
      stored.forEach(dao::insert);
    });
    log.info("savePrecheckResults(): {} checks", stored.size());
    return stored;
  }

  public List<PrecheckResult> listByCase(final String caseId) {
    return precheckDao.listByCase(caseId);
  }

  /**
   * Recompute a check's record hash.
   *
   * @param check the check
   * @return the hash
   */
  public String recordHashOf(final PrecheckResult check) {
    return hashHelper.text(
        check.checkId(),
        check.caseId(),
        check.deviceId().orElse(""),
        check.scanScope().value(),
        check.checkCode(),
        check.status().value(),
        check.message(),
        check.detailJson(),
        Long.toString(check.checkedAt()));
  }
}
