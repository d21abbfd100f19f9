package io.github.cryptoinspector.verify;

import io.github.cryptoinspector.helper.HashHelper;
import io.github.cryptoinspector.model.AuditEvent;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Walks audit events in chain order and reports every broken link and every event whose hash
 * does not match its fields.
 *
 * <p>Each event's hash is recomputed from its own stored previous hash, so tampering with one
 * event's fields flags only that event, while rewriting one event's chain hash flags the link
 * into the next event. Failures do not cascade down the chain.
 */
@Singleton
public class AuditChainVerifier {

  private final HashHelper hashHelper;

  @Inject
  public AuditChainVerifier(final HashHelper hashHelper) {
    this.hashHelper = hashHelper;
  }

  /**
   * Walk the events.
   *
   * @param events the events, in (occurredAt, eventId) order
   * @return the result
   */
  public ChainVerificationResult verify(final List<AuditEvent> events) {
    final List<ChainFailure> failures = new ArrayList<>();
    String expectedPrev = "";
    int failed = 0;
    int prevFailed = 0;
    int hashFailed = 0;
    for (int i = 0; i < events.size(); i++) {
      final AuditEvent event = events.get(i);
      boolean bad = false;
      if (!expectedPrev.equals(event.chainPrevHash())) {
        failures.add(failure(i, event, ChainFailureKind.PREV_HASH, expectedPrev, event.chainPrevHash()));
        prevFailed++;
        bad = true;
      }
      final String recomputed = hashHelper.chainHash(event.chainPrevHash(), event.caseId(), event.eventType(),
          event.action(), event.status().value(), event.occurredAt(), event.detailJson());
      if (!recomputed.equals(event.chainHash())) {
        failures.add(failure(i, event, ChainFailureKind.CHAIN_HASH, recomputed, event.chainHash()));
        hashFailed++;
        bad = true;
      }
      if (bad) {
        failed++;
      }
      expectedPrev = event.chainHash();
    }
    return ImmutableChainVerificationResult.builder()
        .ok(failed == 0)
        .total(events.size())
        .failed(failed)
        .prevHashFailed(prevFailed)
        .chainHashFailed(hashFailed)
        .lastChainHash(expectedPrev)
        .failures(failures)
        .build();
  }

  private static ChainFailure failure(final int index,
                                      final AuditEvent event,
                                      final ChainFailureKind kind,
                                      final String expected,
                                      final String actual) {
    return ImmutableChainFailure.builder()
        .index(index)
        .eventId(event.eventId())
        .kind(kind)
        .expected(expected)
        .actual(actual)
        .build();
  }
}
