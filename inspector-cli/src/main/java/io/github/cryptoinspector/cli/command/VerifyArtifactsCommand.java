package io.github.cryptoinspector.cli.command;

import io.github.cryptoinspector.cli.InspectorCli;
import io.github.cryptoinspector.cli.dagger.CliComponent;
import io.github.cryptoinspector.verify.ArtifactVerificationResult;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Re-hashes the stored snapshots of a case against their metadata.
 */
@Command(
    name = "artifacts",
    description = "Verify the evidence snapshots of a case")
public class VerifyArtifactsCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(VerifyArtifactsCommand.class);

  @Spec
  private CommandSpec spec;

  @Mixin
  private InspectorOptions options;

  @Option(
      names = {"--case-id", "-c"},
      description = "Case to verify",
      required = true)
  private String caseId;

  @Option(
      names = {"--artifact-id", "-a"},
      description = "Verify only this artifact")
  private String artifactId;

  @Option(
      names = {"--json"},
      description = "Print the full result as JSON")
  private boolean json;

  @Override
  public Integer call() throws Exception {
    log.info("Verifying artifacts of case '{}'", caseId);
    final CliComponent component = CliComponent.create(options.configuration());
    final ArtifactVerificationResult result = component.verificationService().verifyArtifacts(caseId, artifactId);
    component.resultPrinter().print(spec.commandLine().getOut(), result, json);
    return result.ok() ? 0 : InspectorCli.EXIT_INTEGRITY;
  }
}
