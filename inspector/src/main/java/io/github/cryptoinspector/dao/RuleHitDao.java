package io.github.cryptoinspector.dao;

import io.github.cryptoinspector.model.HitArtifactLink;
import io.github.cryptoinspector.model.RuleHit;
import java.util.List;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindPojo;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Rule hits and their artifact links. Rows read back have empty artifact id lists; the
 * manager joins the links in.
 */
public interface RuleHitDao {

  @SqlUpdate("insert into RULE_HIT (HIT_ID, CASE_ID, DEVICE_ID, HIT_TYPE, RULE_ID, RULE_NAME, RULE_VERSION, "
      + "MATCHED_VALUE, FIRST_SEEN_AT, LAST_SEEN_AT, CONFIDENCE, VERDICT, DETAIL_JSON) values (:hitId, :caseId, "
      + ":deviceId, :hitType, :ruleId, :ruleName, :ruleVersion, :matchedValue, :firstSeenAt, :lastSeenAt, "
      + ":confidence, :verdict, :detailJson)")
  void insertHit(@BindPojo RuleHit hit);

  @SqlUpdate("insert into HIT_ARTIFACT_LINK (HIT_ID, ARTIFACT_ID, RELATION, CREATED_AT) "
      + "values (:hitId, :artifactId, :relation, :createdAt)")
  void insertLink(@BindPojo HitArtifactLink link);

  @SqlQuery("select * from RULE_HIT where CASE_ID = :caseId order by FIRST_SEEN_AT, HIT_ID")
  List<RuleHit> listHits(@Bind("caseId") String caseId);

  @SqlQuery("select l.* from HIT_ARTIFACT_LINK l join RULE_HIT h on h.HIT_ID = l.HIT_ID "
      + "where h.CASE_ID = :caseId order by l.HIT_ID, l.ARTIFACT_ID")
  List<HitArtifactLink> listLinks(@Bind("caseId") String caseId);
}
