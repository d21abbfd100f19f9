package io.github.cryptoinspector.cli.command;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Groups the export commands.
 */
@Command(
    name = "export",
    description = "Export case evidence",
    mixinStandardHelpOptions = true,
    subcommands = {ExportForensicZipCommand.class})
public class ExportCommand implements Runnable {

  @Spec
  private CommandSpec spec;

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }
}
