package ca.gc.cra.ember.api;

import ca.gc.cra.ember.api.ConfigCliUtils.CliAbort;
import ca.gc.cra.ember.application.fusion.ChannelLimit;
import ca.gc.cra.ember.config.CompositionRoot;
import ca.gc.cra.ember.config.EmberConfig;
import ca.gc.cra.ember.domain.fusion.SensorChannel;
import ca.gc.cra.ember.infrastructure.metrics.MetricsCollector;
import ca.gc.cra.ember.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.ember.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.ember.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs ingestion, fusion, and the device scheduler until the process is interrupted.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String MODE = "serve";
  private static final String SUMMARY_USAGE =
      "usage: serve [config=PATH] [ingest.port=N] [registry=PATH] [scheduler.enabled=true|false] "
          + "[fusion.confidencePolicy=mean|max|weighted] [metrics.exporter=prometheus|otlp|none] "
          + "[key=value...] [--dry-run]";
  private static final String HELP_TEXT = """
      EMBER ingestion, fusion and scheduling service

      Usage:
        serve [config=PATH] [key=value...] [--dry-run]

      Common options:
        config=PATH                    YAML file with a 'common' and a 'serve' section
        ingest.bindHost=HOST           Listen address (default 0.0.0.0)
        ingest.port=1-65535            Listen port (default 9000)
        ingest.maxConnections=N        Concurrent field units (default 64)
        ingest.useDeviceOffset=BOOL    Apply EEPROM device offsets to later frames (default false)
        ingest.autoPeriodOnConnect=BOOL  Send PERIOD_ON to newly connected units (default false)
        fusion.<channel>.threshold=X   Channel threshold (temperature, gas, smoke, flame, vision)
        fusion.minSources=N            Channels required to raise an alarm (default 2)
        fusion.holdMillis=N            Decision hold after an alarm (default 5000)
        fusion.confidencePolicy=NAME   mean, max or weighted (default mean)
        fusion.gasFromAdc1=BOOL        Derive gas ppm from the smoke ADC (default false)
        scheduler.enabled=BOOL         Run the device scheduler (default true)
        registry=PATH                  Device registry YAML (default ~/.ember/devices.yaml)
        streams.<id>=LOCATION          Map a vision stream to a location
        metrics.exporter=NAME          prometheus, otlp or none (default prometheus)
        metrics.port=N                 Prometheus listen port (default 9464)
        metrics.otlpEndpoint=URL       OTLP collector when exporter=otlp
        logging.level.<logger>=LEVEL   Adjust one logger
        --dry-run                      Validate inputs and print plan without starting
        --verbose                      Enable DEBUG logging
        --help                         Show this message
      """;

  private ServeCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Validates the configuration, then serves until interrupted.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, new CountDownLatch(1));
  }

  /**
   * Variant whose shutdown is triggered by counting down {@code stopSignal}.
   *
   * @param args raw CLI arguments
   * @param stopSignal released to stop serving
   * @return exit code
   */
  static ExitCode run(String[] args, CountDownLatch stopSignal) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve");
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, CliArgsParser.toMap(input.keyValueArgs()), SUMMARY_USAGE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    EmberConfig config;
    try {
      config = EmberConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun", false);
    if (dryRun) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    TelemetryConfigurator.configureMetrics(config.metrics());
    SystemClockAdapter clock = new SystemClockAdapter();
    CompositionRoot root;
    try {
      root = new CompositionRoot(config, new OpenTelemetryMetricsAdapter(new MetricsCollector(clock)), clock);
    } catch (IllegalArgumentException ex) {
      log.error("Serve configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unable to initialise metrics or services", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    return serve(root, stopSignal);
  }

  private static ExitCode serve(CompositionRoot root, CountDownLatch stopSignal) {
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested");
      stopSignal.countDown();
      root.close();
    }, "ember-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      root.start();
      stopSignal.await();
      log.info("EMBER stopping");
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Serve I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Serve configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Serve interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while serving", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      root.close();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; hook stays registered");
    }
  }

  private static void printDryRunPlan(EmberConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Serve dry-run: no sockets will be opened.");
    lines.add(" Listen            : " + config.ingest().bindHost() + ":" + config.ingest().port());
    lines.add(" Max connections   : " + config.ingest().maxConnections());
    lines.add(" Max packet bytes  : " + config.ingest().maxPacketBytes());
    lines.add(" Device offsets    : " + config.ingest().useDeviceOffset());
    lines.add(" Auto PERIOD_ON    : " + config.ingest().autoPeriodOnConnect());
    lines.add(" Thermal           : raw*" + config.thermal().scale() + "+" + config.thermal().offset()
        + (config.thermal().signed() ? " (signed)" : " (unsigned)"));
    for (SensorChannel channel : SensorChannel.values()) {
      ChannelLimit limit = config.fusion().limit(channel);
      lines.add(String.format(Locale.ROOT, " %-18s: threshold=%s saturation=%s",
          channel.name().toLowerCase(Locale.ROOT), limit.threshold(), limit.saturation()));
    }
    lines.add(" Min sources       : " + config.fusion().minSources());
    lines.add(" Hold (ms)         : " + config.fusion().holdMillis());
    lines.add(" Confidence policy : " + config.confidencePolicy());
    lines.add(" Rate              : base=" + config.rate().baseFps() + " min=" + config.rate().minFps()
        + " max=" + config.rate().maxFps());
    lines.add(" Scheduler         : " + (config.schedulerEnabled() ? "enabled" : "disabled"));
    lines.add(" Registry          : " + config.registry());
    lines.add(" Streams           : " + (config.streams().isEmpty() ? "<none>" : config.streams()));
    lines.add(" Metrics exporter  : " + config.metrics().exporter());
    lines.add(" Re-run without --dry-run to start serving.");
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
