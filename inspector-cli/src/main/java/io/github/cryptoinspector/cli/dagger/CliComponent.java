package io.github.cryptoinspector.cli.dagger;

import dagger.Component;
import io.github.cryptoinspector.cli.output.ResultPrinter;
import io.github.cryptoinspector.dagger.CommonModule;
import io.github.cryptoinspector.dagger.ConfigurationModule;
import io.github.cryptoinspector.dagger.InspectorModule;
import io.github.cryptoinspector.export.ForensicExporter;
import io.github.cryptoinspector.model.Configuration;
import io.github.cryptoinspector.verify.VerificationService;
import javax.inject.Singleton;

/**
 * Dagger component for CLI tool.
 */
@Singleton
@Component(
    modules = {CliModule.class, InspectorModule.class, ConfigurationModule.class, CommonModule.class})
public interface CliComponent {

  /**
   * Create CLI component with configuration.
   *
   * @param configuration the configuration
   * @return the CLI component
   */
  static CliComponent create(final Configuration configuration) {
    return DaggerCliComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  VerificationService verificationService();

  ForensicExporter forensicExporter();

  ResultPrinter resultPrinter();
}
