package ca.gc.cra.ember.api;

import ca.gc.cra.ember.api.ConfigCliUtils.CliAbort;
import ca.gc.cra.ember.application.port.MetricsPort;
import ca.gc.cra.ember.application.rate.AdaptiveRateController;
import ca.gc.cra.ember.config.RateSimConfig;
import ca.gc.cra.ember.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a backlog-depth sequence through the adaptive rate controller on simulated time and prints the
 * resulting frame rates.
 *
 * @since 0.1.0
 */
public final class RateSimCli {
  private static final Logger log = LoggerFactory.getLogger(RateSimCli.class);
  private static final String MODE = "ratesim";
  private static final String SUMMARY_USAGE =
      "usage: ratesim depths=D1,D2,... [stepMillis=N] [stream=ID] [rate.baseFps=N] [rate.minFps=N] "
          + "[rate.maxFps=N] [rate.highWatermark=N] [rate.lowWatermark=N] [rate.cooldownMillis=N]";
  private static final String HELP_TEXT = """
      EMBER adaptive rate simulation

      Usage:
        ratesim depths=0,3,8,12,8,2 [options]

      Options:
        depths=LIST             Queue depths observed, one per step
        stepMillis=N            Simulated time between observations (default 1000)
        stream=ID               Stream id in the output (default stream-1)
        rate.baseFps=N          Starting rate (default 25)
        rate.minFps=N           Lower bound (default 5)
        rate.maxFps=N           Upper bound (default 30)
        rate.highWatermark=N    Depth at which the rate drops by 25% (default 8)
        rate.lowWatermark=N     Depth below which the rate climbs by 1 (default 2)
        rate.cooldownMillis=N   Minimum time between changes (default 1000)
      """;

  private RateSimCli() {}

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

    RateSimConfig config;
    try {
      Map<String, String> effective =
          ConfigCliUtils.effectiveConfig(MODE, CliArgsParser.toMap(input.keyValueArgs()), SUMMARY_USAGE);
      config = RateSimConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ratesim arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    List<Integer> rates = simulate(config);
    CliPrinter.println(String.format(Locale.ROOT, "%-8s %-8s %-6s %s", "T(ms)", "DEPTH", "FPS", "INTERVAL(ms)"));
    for (int i = 0; i < rates.size(); i++) {
      int fps = rates.get(i);
      CliPrinter.println(String.format(Locale.ROOT, "%-8d %-8d %-6d %d",
          i * config.stepMillis(), config.depths().get(i), fps, 1_000 / fps));
    }
    CliPrinter.println("fps " + config.stream() + ": " + rates);
    return ExitCode.SUCCESS;
  }

  /**
   * Feeds every depth into a fresh controller, advancing a simulated clock by {@code stepMillis} per step.
   *
   * @param config simulation settings
   * @return frame rate returned after each observation
   */
  static List<Integer> simulate(RateSimConfig config) {
    AtomicLong now = new AtomicLong();
    AdaptiveRateController controller = new AdaptiveRateController(config.rate(), now::get, MetricsPort.NO_OP);
    List<Integer> rates = new ArrayList<>();
    for (int depth : config.depths()) {
      rates.add(controller.update(config.stream(), depth));
      now.addAndGet(config.stepMillis());
    }
    return rates;
  }
}
