package io.github.cryptoinspector.cli.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.cryptoinspector.dagger.InspectorModule;
import javax.inject.Singleton;

/**
 * The slice of the core graph needed to verify a package with no database configured.
 */
@Module
public class OfflineModule {

  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new InspectorModule().objectMapper();
  }
}
