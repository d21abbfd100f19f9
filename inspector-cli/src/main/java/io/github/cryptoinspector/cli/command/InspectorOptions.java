package io.github.cryptoinspector.cli.command;

import io.github.cryptoinspector.dbu.model.Database;
import io.github.cryptoinspector.dbu.model.ImmutableDatabase;
import io.github.cryptoinspector.model.Configuration;
import io.github.cryptoinspector.model.ImmutableConfiguration;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Option;

/**
 * Database and directory options shared by every command that opens the case database.
 */
public class InspectorOptions {

  @Option(
      names = {"--db-url"},
      description = "Database JDBC URL (default: env INSPECTOR_DB_URL, else ${DEFAULT-VALUE})",
      defaultValue = "${INSPECTOR_DB_URL:-jdbc:hsqldb:file:data/inspector;hsqldb.tx=mvcc}")
  private String dbUrl;

  @Option(
      names = {"--db-user"},
      description = "Database username (default: env INSPECTOR_DB_USER)",
      defaultValue = "${INSPECTOR_DB_USER:-SA}")
  private String dbUser;

  @Option(
      names = {"--db-password"},
      description = "Database password (default: env INSPECTOR_DB_PASSWORD)",
      defaultValue = "${INSPECTOR_DB_PASSWORD:-}")
  private String dbPassword;

  @Option(
      names = {"--evidence-root"},
      description = "Directory holding evidence snapshots (default: ${DEFAULT-VALUE})",
      defaultValue = "data/evidence")
  private Path evidenceRoot;

  @Option(
      names = {"--export-dir"},
      description = "Directory forensic packages are written to (default: ${DEFAULT-VALUE})",
      defaultValue = "data/exports")
  private Path exportDir;

  @Option(
      names = {"--reports-root"},
      description = "Directory holding report files (default: ${DEFAULT-VALUE})",
      defaultValue = "data/reports")
  private Path reportsRoot;

  @Option(
      names = {"--rules"},
      description = "Rule files bundled into forensic packages",
      split = ",")
  private List<Path> rules = new ArrayList<>();

  /**
   * Build the core configuration from the options.
   *
   * @return the configuration
   */
  public Configuration configuration() {
    if (dbUrl == null || dbUrl.isBlank()) {
      throw new IllegalArgumentException("Database URL is required. Set --db-url or INSPECTOR_DB_URL.");
    }
    final Database database =
        ImmutableDatabase.builder()
            .url(dbUrl)
            .username(dbUser != null ? dbUser : "")
            .password(dbPassword != null ? dbPassword : "")
            .build();
    return ImmutableConfiguration.builder()
        .database(database)
        .evidenceRoot(evidenceRoot)
        .exportDir(exportDir)
        .reportsRoot(reportsRoot)
        .ruleFiles(rules)
        .build();
  }
}
