package io.github.cryptoinspector.helper;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Generates readable unique ids of the form {@code prefix_epochMillis_randomHex}.
 */
@Singleton
public class IdGenerator {

  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  @Inject
  public IdGenerator(final Clock clock) {
    this.clock = clock;
  }

  public String newId(final String prefix) {
    final byte[] suffix = new byte[6];
    random.nextBytes(suffix);
    return prefix + "_" + clock.millis() + "_" + HexFormat.of().formatHex(suffix);
  }
}
