package io.github.cryptoinspector.cli.command;

import io.github.cryptoinspector.cli.InspectorCli;
import io.github.cryptoinspector.cli.dagger.CliComponent;
import io.github.cryptoinspector.verify.ChainVerificationResult;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Walks the audit chain of a case.
 */
@Command(
    name = "audits",
    description = "Verify the audit chain of a case")
public class VerifyAuditsCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(VerifyAuditsCommand.class);

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
      names = {"--limit", "-n"},
      description = "Walk only the first N events; 0 walks all (default: ${DEFAULT-VALUE})",
      defaultValue = "0")
  private int limit;

  @Option(
      names = {"--json"},
      description = "Print the full result as JSON")
  private boolean json;

  @Override
  public Integer call() throws Exception {
    log.info("Verifying audit chain of case '{}' (limit {})", caseId, limit);
    final CliComponent component = CliComponent.create(options.configuration());
    final ChainVerificationResult result = component.verificationService().verifyAuditChain(caseId, limit);
    component.resultPrinter().print(spec.commandLine().getOut(), result, json);
    return result.ok() ? 0 : InspectorCli.EXIT_INTEGRITY;
  }
}
