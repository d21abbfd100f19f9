package io.github.cryptoinspector.manager;

import io.github.cryptoinspector.dao.RuleHitDao;
import io.github.cryptoinspector.model.HitArtifactLink;
import io.github.cryptoinspector.model.ImmutableHitArtifactLink;
import io.github.cryptoinspector.model.ImmutableRuleHit;
import io.github.cryptoinspector.model.LinkRelation;
import io.github.cryptoinspector.model.RuleHit;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores rule engine hits together with the artifacts they point at.
 */
@Singleton
public class RuleHitManager {

  private static final Logger log = LoggerFactory.getLogger(RuleHitManager.class);

  private final Jdbi jdbi;
  private final RuleHitDao ruleHitDao;
  private final CaseManager caseManager;
  private final Clock clock;

  @Inject
  public RuleHitManager(final Jdbi jdbi,
                        final RuleHitDao ruleHitDao,
                        final CaseManager caseManager,
                        final Clock clock) {
    this.jdbi = jdbi;
    this.ruleHitDao = ruleHitDao;
    this.caseManager = caseManager;
    this.clock = clock;
  }

  /**
   * Store hits and their artifact links in one transaction.
   *
   * @param hits the hits
   */
  public void saveHits(final List<RuleHit> hits) {
    if (hits.isEmpty()) {
      return;
    }
    for (RuleHit hit : hits) {
      if (!(hit.confidence() >= 0.0 && hit.confidence() <= 1.0)) {
        throw new IllegalArgumentException("confidence out of range for " + hit.hitId() + ": " + hit.confidence());
      }
    }
    hits.stream().map(RuleHit::caseId).distinct().forEach(caseManager::ensureCase);
    final long now = clock.millis();
    jdbi.useTransaction(handle -> {
      final RuleHitDao dao = handle.attach(RuleHitDao.class);
      for (RuleHit hit : hits) {
        dao.insertHit(hit);
        for (String artifactId : new LinkedHashSet<>(hit.artifactIds())) {
          dao.insertLink(link(hit, artifactId, LinkRelation.DIRECT, now));
        }
        for (String artifactId : new LinkedHashSet<>(hit.derivedArtifactIds())) {
          dao.insertLink(link(hit, artifactId, LinkRelation.DERIVED, now));
        }
      }
    });
    log.info("saveHits(): {} hits", hits.size());
  }

  /**
   * Hits of a case with their linked artifact ids, sorted.
   *
   * @param caseId the case id
   * @return the hits
   */
  public List<RuleHit> listHitDetails(final String caseId) {
    final Map<String, List<HitArtifactLink>> linksByHit = ruleHitDao.listLinks(caseId).stream()
        .collect(Collectors.groupingBy(HitArtifactLink::hitId, TreeMap::new, Collectors.toList()));
    final List<RuleHit> result = new ArrayList<>();
    for (RuleHit hit : ruleHitDao.listHits(caseId)) {
      final List<HitArtifactLink> links = linksByHit.getOrDefault(hit.hitId(), List.of());
      result.add(ImmutableRuleHit.copyOf(hit)
          .withArtifactIds(idsFor(links, LinkRelation.DIRECT))
          .withDerivedArtifactIds(idsFor(links, LinkRelation.DERIVED)));
    }
    return result;
  }

  private static TreeSet<String> idsFor(final List<HitArtifactLink> links, final LinkRelation relation) {
    return links.stream()
        .filter(l -> l.relation() == relation)
        .map(HitArtifactLink::artifactId)
        .collect(Collectors.toCollection(TreeSet::new));
  }

  private static HitArtifactLink link(final RuleHit hit,
                                      final String artifactId,
                                      final LinkRelation relation,
                                      final long now) {
    return ImmutableHitArtifactLink.builder()
        .hitId(hit.hitId())
        .artifactId(artifactId)
        .relation(relation)
        .createdAt(now)
        .build();
  }
}
