package io.github.cryptoinspector.cli.command;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Groups the verification commands.
 */
@Command(
    name = "verify",
    description = "Verify evidence integrity",
    mixinStandardHelpOptions = true,
    subcommands = {VerifyForensicZipCommand.class, VerifyArtifactsCommand.class, VerifyAuditsCommand.class})
public class VerifyCommand implements Runnable {

  @Spec
  private CommandSpec spec;

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }
}
