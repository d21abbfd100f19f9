package io.github.cryptoinspector.dagger;

import dagger.Component;
import io.github.cryptoinspector.export.ForensicExporter;
import io.github.cryptoinspector.manager.ArtifactStore;
import io.github.cryptoinspector.manager.AuditChain;
import io.github.cryptoinspector.manager.CaseManager;
import io.github.cryptoinspector.manager.DeviceManager;
import io.github.cryptoinspector.manager.PrecheckManager;
import io.github.cryptoinspector.manager.ReportManager;
import io.github.cryptoinspector.manager.RuleHitManager;
import io.github.cryptoinspector.model.Configuration;
import io.github.cryptoinspector.verify.OfflineVerifier;
import io.github.cryptoinspector.verify.VerificationService;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The evidence core's object graph.
 */
@Singleton
@Component(modules = {InspectorModule.class, ConfigurationModule.class, CommonModule.class})
public interface InspectorComponent {

  /**
   * Build the graph for a configuration.
   *
   * @param configuration the configuration
   * @return the component
   */
  static InspectorComponent instance(final Configuration configuration) {
    return DaggerInspectorComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  CaseManager caseManager();

  DeviceManager deviceManager();

  ArtifactStore artifactStore();

  AuditChain auditChain();

  RuleHitManager ruleHitManager();

  PrecheckManager precheckManager();

  ReportManager reportManager();

  VerificationService verificationService();

  ForensicExporter forensicExporter();

  OfflineVerifier offlineVerifier();

  /**
   * The migrated database handle, for maintenance and tests.
   *
   * @return the jdbi
   */
  Jdbi jdbi();
}
