package io.github.cryptoinspector.model;

import io.github.cryptoinspector.dbu.model.Database;
import java.nio.file.Path;
import java.util.List;
import org.immutables.value.Value;

/**
 * Runtime configuration of the evidence core.
 */
@Value.Immutable
public interface Configuration {

  /**
   * Case database connection.
   *
   * @return the database
   */
  Database database();

  /**
   * Directory that snapshot files are written under, scoped by case and device.
   *
   * @return the evidence root
   */
  @Value.Default
  default Path evidenceRoot() {
    return Path.of("data", "evidence");
  }

  /**
   * Directory that forensic packages are written to.
   *
   * @return the export dir
   */
  @Value.Default
  default Path exportDir() {
    return Path.of("data", "exports");
  }

  /**
   * Directory that report files live under. Report paths are made relative to it inside a
   * forensic package.
   *
   * @return the reports root
   */
  @Value.Default
  default Path reportsRoot() {
    return Path.of("data", "reports");
  }

  /**
   * Rule files bundled into every forensic package under {@code rules/}.
   *
   * @return the rule files
   */
  List<Path> ruleFiles();

  /**
   * Build identification.
   *
   * @return the app info
   */
  @Value.Default
  default AppInfo appInfo() {
    return AppInfo.unknown();
  }

  /**
   * Operator recorded as the actor when a caller does not name one.
   *
   * @return the operator
   */
  @Value.Default
  default String defaultOperator() {
    return "system";
  }
}
