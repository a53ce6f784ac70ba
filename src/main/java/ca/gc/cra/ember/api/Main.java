package ca.gc.cra.ember.api;

import ca.gc.cra.ember.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EMBER CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: ember <serve|devices|simulate|ratesim> [options]";
  private static final String HELP_TEXT = """
      EMBER command dispatcher

      Usage:
        ember <command> [options]

      Commands:
        serve       Ingest field-unit data, fuse alarms and poll devices (serve --help for details)
        devices     List, add or remove registered response devices
        simulate    Simulate field units sending frames and sensor samples
        ratesim     Replay queue depths through the adaptive rate controller

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = indexOfCommand(raw);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(raw);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    List<String> delegate = new ArrayList<>(Arrays.asList(raw).subList(0, commandIndex));
    delegate.addAll(Arrays.asList(raw).subList(commandIndex + 1, raw.length));
    String[] delegateArgs = delegate.toArray(String[]::new);
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs);
      case "devices" -> DevicesCli.run(delegateArgs);
      case "simulate" -> SimulateCli.run(delegateArgs);
      case "ratesim" -> RateSimCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int indexOfCommand(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
