package io.github.cryptoinspector.manager;

import io.github.cryptoinspector.dao.AuditEventDao;
import io.github.cryptoinspector.helper.HashHelper;
import io.github.cryptoinspector.helper.IdGenerator;
import io.github.cryptoinspector.helper.JsonHelper;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.AuditStatus;
import io.github.cryptoinspector.model.ImmutableAuditEvent;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The per case, hash linked, append-only audit log.
 *
 * <p>Reading the tail and inserting the new event happen under the case's lock stripe and inside
 * one transaction, so each case has exactly one writer at a time while cases on different stripes
 * append in parallel. {@code occurredAt} is forced past the tail's so chain order is total.
 */
@Singleton
public class AuditChain {

  static final int LOCK_STRIPES = 64;

  private static final Logger log = LoggerFactory.getLogger(AuditChain.class);

  private final Jdbi jdbi;
  private final AuditEventDao auditEventDao;
  private final CaseManager caseManager;
  private final HashHelper hashHelper;
  private final JsonHelper jsonHelper;
  private final IdGenerator idGenerator;
  private final Clock clock;
  // Fixed stripe count bounds the lock table; cases sharing a stripe append one after another.
  private final ReentrantLock[] caseLocks = new ReentrantLock[LOCK_STRIPES];

  /**
   * Instantiates a new Audit chain.
   *
   * @param jdbi          the jdbi
   * @param auditEventDao the audit event dao
   * @param caseManager   the case manager
   * @param hashHelper    the hash helper
   * @param jsonHelper    the json helper
   * @param idGenerator   the id generator
   * @param clock         the clock
   */
  @Inject
  public AuditChain(final Jdbi jdbi,
                    final AuditEventDao auditEventDao,
                    final CaseManager caseManager,
                    final HashHelper hashHelper,
                    final JsonHelper jsonHelper,
                    final IdGenerator idGenerator,
                    final Clock clock) {
    log.info("AuditChain({})", jdbi);
    this.jdbi = jdbi;
    this.auditEventDao = auditEventDao;
    this.caseManager = caseManager;
    this.hashHelper = hashHelper;
    this.jsonHelper = jsonHelper;
    this.idGenerator = idGenerator;
    this.clock = clock;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      caseLocks[i] = new ReentrantLock();
    }
  }

  ReentrantLock lockFor(final String caseId) {
    return caseLocks[Math.floorMod(caseId.hashCode(), LOCK_STRIPES)];
  }

  /**
   * Append an event to the case's chain, creating the case if needed.
   *
   * @param caseId    the case id
   * @param deviceId  the device id, may be null
   * @param eventType the event type, e.g. collect, export, verify
   * @param action    the action within the event type
   * @param status    the status
   * @param actor     who performed it
   * @param source    the code location that recorded it
   * @param detail    structured detail, may be null
   * @return the stored event
   */
  public AuditEvent append(final String caseId,
                           final String deviceId,
                           final String eventType,
                           final String action,
                           final AuditStatus status,
                           final String actor,
                           final String source,
                           final Map<String, ?> detail) {
    CaseManager.requireId(caseId);
    final String detailJson = jsonHelper.detail(detail);
    caseManager.ensureCase(caseId);

    final ReentrantLock lock = lockFor(caseId);
    lock.lock();
    try {
      final AuditEvent event = jdbi.inTransaction(handle -> {
        final AuditEventDao dao = handle.attach(AuditEventDao.class);
        final Optional<AuditEvent> tail = dao.tail(caseId);
        final String prev = tail.map(AuditEvent::chainHash).orElse("");
        final long now = clock.millis();
        final long occurredAt = tail.map(t -> Math.max(now, t.occurredAt() + 1)).orElse(now);
        final AuditEvent linked = ImmutableAuditEvent.builder()
            .eventId(idGenerator.newId("audit"))
            .caseId(caseId)
            .deviceId(Optional.ofNullable(CaseManager.isBlank(deviceId) ? null : deviceId))
            .eventType(eventType)
            .action(action)
            .status(status)
            .actor(actor == null ? "" : actor)
            .source(source == null ? "" : source)
            .detailJson(detailJson)
            .occurredAt(occurredAt)
            .chainPrevHash(prev)
            .chainHash(hashHelper.chainHash(prev, caseId, eventType, action, status.value(), occurredAt,
                detailJson))
            .build();
        dao.insert(linked);
        return linked;
      });
      log.debug("append({}, {}/{}, {}): {}", caseId, eventType, action, status.value(), event.eventId());
      return event;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Events of a case in chain order.
   *
   * @param caseId the case id
   * @param limit  the maximum number of events; zero or less means all
   * @return the events
   */
  public List<AuditEvent> list(final String caseId, final int limit) {
    return limit <= 0 ? auditEventDao.listAll(caseId) : auditEventDao.list(caseId, limit);
  }

  public Optional<AuditEvent> tail(final String caseId) {
    return auditEventDao.tail(caseId);
  }
}
