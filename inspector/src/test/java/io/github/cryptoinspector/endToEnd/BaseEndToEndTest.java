package io.github.cryptoinspector.endToEnd;

import io.github.cryptoinspector.dagger.InspectorComponent;
import io.github.cryptoinspector.dbu.model.ImmutableDatabase;
import io.github.cryptoinspector.model.Configuration;
import io.github.cryptoinspector.model.ImmutableConfiguration;
import java.nio.file.Path;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

public abstract class BaseEndToEndTest {

  @TempDir
  protected Path tempDir;

  protected Configuration configuration;
  protected InspectorComponent component;
  private boolean shutdown;

  protected ImmutableConfiguration.Builder configurationBuilder() {
    return ImmutableConfiguration.builder()
        .database(
            ImmutableDatabase.builder()
                .url("jdbc:hsqldb:mem:" + getClass().getSimpleName() + UUID.randomUUID() + ";hsqldb.tx=mvcc")
                .username("SA")
                .password("")
                .build())
        .evidenceRoot(tempDir.resolve("evidence"))
        .exportDir(tempDir.resolve("exports"))
        .reportsRoot(tempDir.resolve("reports"));
  }

  @BeforeEach
  void setupComponent() {
    configuration = configurationBuilder().build();
    component = InspectorComponent.instance(configuration);
  }

  @AfterEach
  void shutdownComponent() {
    if (!shutdown) {
      shutdownDatabase();
    }
  }

  /**
   * Stop the in-memory database, discarding everything in it.
   */
  protected void shutdownDatabase() {
    shutdown = true;
    try {
      component.jdbi().useHandle(handle -> handle.execute("SHUTDOWN"));
    } catch (Exception e) {
      // The connection is closed by the shutdown itself.
    }
  }

}
