package io.github.cryptoinspector.export;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Per export settings.
 */
@Value.Immutable
public interface ExportOptions {

  /**
   * Free text stored in the manifest.
   *
   * @return the note
   */
  @Value.Default
  default String note() {
    return "";
  }

  /**
   * Operator recorded on the export audit event. Falls back to the configured default.
   *
   * @return the operator
   */
  Optional<String> operator();

  /**
   * Directory to write the package to instead of the configured one.
   *
   * @return the dir
   */
  Optional<Path> exportDir();

  /**
   * Rule files to bundle instead of the configured ones. Empty means use the configured ones.
   *
   * @return the rule files
   */
  List<Path> ruleFiles();

  static ExportOptions defaults() {
    return ImmutableExportOptions.builder().build();
  }
}
