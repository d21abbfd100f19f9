package io.github.cryptoinspector.cli.command;

import io.github.cryptoinspector.cli.dagger.CliComponent;
import io.github.cryptoinspector.export.ExportResult;
import io.github.cryptoinspector.export.ImmutableExportOptions;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Packages a case into a self-verifying forensic zip.
 */
@Command(
    name = "forensic-zip",
    description = "Export a case as a forensic zip with manifest and hash list")
public class ExportForensicZipCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(ExportForensicZipCommand.class);

  @Spec
  private CommandSpec spec;

  @Mixin
  private InspectorOptions options;

  @Option(
      names = {"--case-id", "-c"},
      description = "Case to export",
      required = true)
  private String caseId;

  @Option(
      names = {"--note"},
      description = "Note stored in the manifest",
      defaultValue = "")
  private String note;

  @Option(
      names = {"--operator"},
      description = "Operator recorded on the export audit event")
  private String operator;

  @Option(
      names = {"--json"},
      description = "Print the full result as JSON")
  private boolean json;

  @Override
  public Integer call() throws Exception {
    log.info("Exporting case '{}'", caseId);
    final CliComponent component = CliComponent.create(options.configuration());
    final ExportResult result = component.forensicExporter().generateForensicZip(caseId,
        ImmutableExportOptions.builder()
            .note(note)
            .operator(Optional.ofNullable(operator))
            .build());
    component.resultPrinter().print(spec.commandLine().getOut(), result, json);
    log.info("Export completed: {}", result.zipPath());
    return result.cancelled() ? 1 : 0;
  }
}
