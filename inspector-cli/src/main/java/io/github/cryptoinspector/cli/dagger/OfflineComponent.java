package io.github.cryptoinspector.cli.dagger;

import dagger.Component;
import io.github.cryptoinspector.cli.output.ResultPrinter;
import io.github.cryptoinspector.verify.OfflineVerifier;
import javax.inject.Singleton;

/**
 * Dagger component for commands that work on a forensic package alone.
 */
@Singleton
@Component(modules = {CliModule.class, OfflineModule.class})
public interface OfflineComponent {

  static OfflineComponent create() {
    return DaggerOfflineComponent.create();
  }

  OfflineVerifier offlineVerifier();

  ResultPrinter resultPrinter();
}
