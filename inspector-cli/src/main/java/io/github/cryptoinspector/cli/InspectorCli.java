package io.github.cryptoinspector.cli;

import io.github.cryptoinspector.cli.command.ExportCommand;
import io.github.cryptoinspector.cli.command.VerifyCommand;
import io.github.cryptoinspector.exception.ArchiveFormatException;
import io.github.cryptoinspector.exception.NotFoundException;
import java.util.zip.ZipException;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for the evidence core.
 */
@Command(
    name = "inspector-cli",
    description = "Export and verify crypto-inspector evidence",
    mixinStandardHelpOptions = true,
    version = "0.3.0",
    subcommands = {ExportCommand.class, VerifyCommand.class})
public class InspectorCli implements Runnable {

  /**
   * Exit code for a completed run that found integrity failures.
   */
  public static final int EXIT_INTEGRITY = 1;

  /**
   * Exit code for bad usage, unknown ids and unreadable archives.
   */
  public static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = commandLine().execute(args);
    System.exit(exitCode);
  }

  /**
   * Command line with the exit code mapping applied. Failures are reported as one line on the
   * error stream.
   *
   * @return the command line
   */
  public static CommandLine commandLine() {
    final CommandLine commandLine = new CommandLine(new InspectorCli());
    commandLine.setExitCodeExceptionMapper(InspectorCli::exitCode);
    commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
      cmd.getErr().println("error: " + ex.getMessage());
      return exitCode(ex);
    });
    return commandLine;
  }

  static int exitCode(final Throwable t) {
    if (t instanceof ArchiveFormatException
        || t instanceof NotFoundException
        || t instanceof IllegalArgumentException
        || t instanceof ZipException) {
      return EXIT_USAGE;
    }
    return EXIT_INTEGRITY;
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, System.out);
  }
}
