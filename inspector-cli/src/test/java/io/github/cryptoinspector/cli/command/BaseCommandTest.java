package io.github.cryptoinspector.cli.command;

import io.github.cryptoinspector.cli.InspectorCli;
import io.github.cryptoinspector.dagger.InspectorComponent;
import io.github.cryptoinspector.dbu.model.ImmutableDatabase;
import io.github.cryptoinspector.model.Configuration;
import io.github.cryptoinspector.model.ImmutableConfiguration;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

public abstract class BaseCommandTest {

  @TempDir
  protected Path tempDir;

  protected String dbUrl;
  protected Configuration configuration;
  protected InspectorComponent component;
  protected StringWriter out;
  protected StringWriter err;

  @BeforeEach
  void setupDatabase() {
    dbUrl = "jdbc:hsqldb:mem:" + getClass().getSimpleName() + UUID.randomUUID() + ";hsqldb.tx=mvcc";
    configuration = ImmutableConfiguration.builder()
        .database(ImmutableDatabase.builder().url(dbUrl).username("SA").password("").build())
        .evidenceRoot(tempDir.resolve("evidence"))
        .exportDir(tempDir.resolve("exports"))
        .reportsRoot(tempDir.resolve("reports"))
        .build();
    component = InspectorComponent.instance(configuration);
  }

  @AfterEach
  void shutdownDatabase() {
    try {
      component.jdbi().useHandle(handle -> handle.execute("SHUTDOWN"));
    } catch (Exception e) {
      // The connection is closed by the shutdown itself.
    }
  }

  /**
   * Run the CLI against the test database and directories.
   *
   * @param args the command and its own options
   * @return the exit code
   */
  protected int run(final String... args) {
    final List<String> all = new ArrayList<>(Arrays.asList(args));
    all.addAll(List.of(
        "--db-url", dbUrl,
        "--db-user", "SA",
        "--evidence-root", configuration.evidenceRoot().toString(),
        "--export-dir", configuration.exportDir().toString(),
        "--reports-root", configuration.reportsRoot().toString()));
    return runRaw(all.toArray(new String[0]));
  }

  protected int runRaw(final String... args) {
    out = new StringWriter();
    err = new StringWriter();
    final CommandLine commandLine = InspectorCli.commandLine();
    commandLine.setOut(new PrintWriter(out, true));
    commandLine.setErr(new PrintWriter(err, true));
    return commandLine.execute(args);
  }
}
