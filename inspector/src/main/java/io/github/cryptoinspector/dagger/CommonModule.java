package io.github.cryptoinspector.dagger;

import dagger.Module;
import dagger.Provides;
import java.time.Clock;
import javax.inject.Singleton;

/**
 * Shared infrastructure.
 */
@Module
public class CommonModule {

  /**
   * Wall clock used for every timestamp the core records.
   *
   * @return the clock
   */
  @Provides
  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }
}
