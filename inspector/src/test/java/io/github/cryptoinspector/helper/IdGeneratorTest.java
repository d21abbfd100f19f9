package io.github.cryptoinspector.helper;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class IdGeneratorTest {

  @Test
  void newId_hasPrefixMillisAndRandomSuffix() {
    final IdGenerator idGenerator = new IdGenerator(Clock.fixed(Instant.ofEpochMilli(1700000000123L), ZoneOffset.UTC));

    final String first = idGenerator.newId("art");
    final String second = idGenerator.newId("art");

    assertThat(first).matches("art_1700000000123_[0-9a-f]{12}");
    assertThat(second).isNotEqualTo(first);
  }
}
