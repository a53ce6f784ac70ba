package ca.gc.cra.ember.api;

import ca.gc.cra.ember.api.ConfigCliUtils.CliAbort;
import ca.gc.cra.ember.config.SimulatorConfig;
import ca.gc.cra.ember.infrastructure.net.FieldUnitSimulator;
import ca.gc.cra.ember.logging.LoggingConfigurator;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one or more simulated field units against a running {@code serve} instance.
 *
 * @since 0.1.0
 */
public final class SimulateCli {
  private static final Logger log = LoggerFactory.getLogger(SimulateCli.class);
  private static final String MODE = "simulate";
  private static final String SUMMARY_USAGE =
      "usage: simulate [host=H] [port=P] location=L [serial=S] [format=SEPARATE|EMBEDDED|CONTINUOUS|NO_LOC] "
          + "[connections=N] [packets=N] [rate=R] [hotspot=C] [seed=N]";
  private static final String HELP_TEXT = """
      EMBER field-unit simulator

      Usage:
        simulate location=L [options]

      Options:
        host=HOST          Ingestion host (default 127.0.0.1)
        port=1-65535       Ingestion port (default 9000)
        location=ID        Location announced by the first unit; further units append -2, -3, ...
        serial=ID          Serial announced by the first unit (default SIM001)
        format=NAME        SEPARATE, EMBEDDED, CONTINUOUS or NO_LOC (default SEPARATE)
        connections=N      Concurrent units (default 1)
        packets=N          Frames plus samples per unit (default 100)
        rate=R             Packets per second per unit (default 20)
        hotspot=C          Hotspot temperature in Celsius (default 35)
        seed=N             Random seed (default 42)
      """;

  private SimulateCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    SimulatorConfig config;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveConfig(MODE, CliArgsParser.toMap(input.keyValueArgs()), SUMMARY_USAGE);
      config = SimulatorConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid simulate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    log.info("Simulating {} unit(s) against {}:{} ({} packets at {}/s, format {})",
        config.connections(), config.host(), config.port(), config.packets(), config.rate(), config.format());
    try {
      FieldUnitSimulator.Report report = new FieldUnitSimulator(config).run();
      CliPrinter.println("Simulation finished: units=" + report.unitsCompleted()
          + " failed=" + report.unitsFailed() + " packets=" + report.packetsSent());
      return report.unitsFailed() == 0 ? ExitCode.SUCCESS : ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Simulation interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in simulator", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
