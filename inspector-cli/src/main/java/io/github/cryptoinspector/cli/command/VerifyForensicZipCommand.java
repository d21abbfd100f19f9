package io.github.cryptoinspector.cli.command;

import io.github.cryptoinspector.cli.InspectorCli;
import io.github.cryptoinspector.cli.dagger.OfflineComponent;
import io.github.cryptoinspector.verify.ZipVerificationResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Verifies a forensic package without touching the case database.
 */
@Command(
    name = "forensic-zip",
    description = "Re-hash a forensic package and walk its embedded audit chain")
public class VerifyForensicZipCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(VerifyForensicZipCommand.class);

  @Spec
  private CommandSpec spec;

  @Option(
      names = {"--zip", "-z"},
      description = "Forensic package to verify",
      required = true)
  private Path zip;

  @Option(
      names = {"--json"},
      description = "Print the full result as JSON")
  private boolean json;

  @Override
  public Integer call() throws Exception {
    log.info("Verifying forensic package {}", zip);
    if (!Files.isRegularFile(zip)) {
      throw new IllegalArgumentException("not a file: " + zip);
    }
    final OfflineComponent component = OfflineComponent.create();
    final ZipVerificationResult result = component.offlineVerifier().verifyForensicZip(zip);
    component.resultPrinter().print(spec.commandLine().getOut(), result, json);
    log.info("Verification finished: ok={}", result.ok());
    return result.ok() ? 0 : InspectorCli.EXIT_INTEGRITY;
  }
}
