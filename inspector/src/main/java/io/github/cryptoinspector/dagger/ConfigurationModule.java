package io.github.cryptoinspector.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.cryptoinspector.dbu.model.Database;
import io.github.cryptoinspector.model.Configuration;
import javax.inject.Singleton;

/**
 * Exposes the caller supplied configuration to the graph.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }

  /**
   * Database the Jdbi factory connects to.
   *
   * @param configuration the configuration
   * @return the database
   */
  @Provides
  @Singleton
  public Database database(final Configuration configuration) {
    return configuration.database();
  }
}
