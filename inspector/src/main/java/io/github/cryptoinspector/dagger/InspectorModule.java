package io.github.cryptoinspector.dagger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.cryptoinspector.dao.ArtifactDao;
import io.github.cryptoinspector.dao.AuditEventDao;
import io.github.cryptoinspector.dao.CaseDao;
import io.github.cryptoinspector.dao.CaseDeviceDao;
import io.github.cryptoinspector.dao.PrecheckDao;
import io.github.cryptoinspector.dao.ReportDao;
import io.github.cryptoinspector.dao.RuleHitDao;
import io.github.cryptoinspector.dbu.factory.JdbiFactory;
import io.github.cryptoinspector.dbu.liquibase.LiquibaseHelper;
import io.github.cryptoinspector.model.Artifact;
import io.github.cryptoinspector.model.AuditEvent;
import io.github.cryptoinspector.model.CaseDevice;
import io.github.cryptoinspector.model.CaseOverview;
import io.github.cryptoinspector.model.CaseRecord;
import io.github.cryptoinspector.model.HitArtifactLink;
import io.github.cryptoinspector.model.PrecheckResult;
import io.github.cryptoinspector.model.Report;
import io.github.cryptoinspector.model.RuleHit;
import java.util.Set;
import javax.inject.Named;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * Persistence and serialization bindings of the evidence core.
 */
@Module
public class InspectorModule {

  /**
   * The constant LIQUIBASE_SETUP_XML.
   */
  public static final String LIQUIBASE_SETUP_XML = "liquibase/liquibase-setup.xml";

  /**
   * Instantiates a new Inspector module.
   */
  public InspectorModule() {
    // Default constructor
  }

  /**
   * Jdbi with the schema migrated.
   *
   * @param factory         the factory
   * @param liquibaseHelper the liquibase helper
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory,
                   final LiquibaseHelper liquibaseHelper) {
    final Jdbi jdbi = factory.createJdbi();
    liquibaseHelper.runLiquibase(jdbi, LIQUIBASE_SETUP_XML);
    return jdbi;
  }

  /**
   * Immutable classes set.
   *
   * @return the set
   */
  @Provides
  @Singleton
  @Named(JdbiFactory.IMMUTABLES)
  public Set<Class<?>> immutableClasses() {
    return Set.of(CaseRecord.class, CaseOverview.class, CaseDevice.class, Artifact.class, RuleHit.class,
        HitArtifactLink.class, PrecheckResult.class, Report.class, AuditEvent.class);
  }

  /**
   * Object mapper for manifests, detail payloads and snapshots.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    final ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.findAndRegisterModules();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    return objectMapper;
  }

  @Provides
  @Singleton
  public CaseDao caseDao(final Jdbi jdbi) {
    return jdbi.onDemand(CaseDao.class);
  }

  @Provides
  @Singleton
  public CaseDeviceDao caseDeviceDao(final Jdbi jdbi) {
    return jdbi.onDemand(CaseDeviceDao.class);
  }

  @Provides
  @Singleton
  public ArtifactDao artifactDao(final Jdbi jdbi) {
    return jdbi.onDemand(ArtifactDao.class);
  }

  @Provides
  @Singleton
  public AuditEventDao auditEventDao(final Jdbi jdbi) {
    return jdbi.onDemand(AuditEventDao.class);
  }

  @Provides
  @Singleton
  public RuleHitDao ruleHitDao(final Jdbi jdbi) {
    return jdbi.onDemand(RuleHitDao.class);
  }

  @Provides
  @Singleton
  public PrecheckDao precheckDao(final Jdbi jdbi) {
    return jdbi.onDemand(PrecheckDao.class);
  }

  @Provides
  @Singleton
  public ReportDao reportDao(final Jdbi jdbi) {
    return jdbi.onDemand(ReportDao.class);
  }
}
