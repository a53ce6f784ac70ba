package ca.gc.cra.ember.config;

import ca.gc.cra.ember.application.fusion.ChannelLimit;
import ca.gc.cra.ember.application.fusion.ConfidencePolicy;
import ca.gc.cra.ember.application.fusion.FusionSettings;
import ca.gc.cra.ember.application.rate.RateSettings;
import ca.gc.cra.ember.application.schedule.SchedulerSettings;
import ca.gc.cra.ember.domain.fusion.SensorChannel;
import ca.gc.cra.ember.domain.record.ThermalCalibration;
import ca.gc.cra.ember.infrastructure.net.IngestSettings;
import ca.gc.cra.ember.validation.Numbers;
import ca.gc.cra.ember.validation.Strings;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated configuration of the {@code serve} command.
 * <p><strong>Why:</strong> Every threshold, pool size, and timeout is checked once at the boundary; components
 * receive typed settings records and never coerce values themselves.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param ingest ingestion listener settings
 * @param thermal thermal calibration
 * @param fusion fusion thresholds and timing
 * @param confidencePolicy confidence policy name ({@code mean}, {@code max}, {@code weighted})
 * @param rate adaptive rate parameters
 * @param scheduler device scheduler settings
 * @param schedulerEnabled whether the device scheduler runs
 * @param registry device registry file
 * @param metrics metrics exporter settings
 * @param streams stream id to location id
 * @since 0.1.0
 */
public record EmberConfig(
    IngestSettings ingest,
    ThermalCalibration thermal,
    FusionSettings fusion,
    String confidencePolicy,
    RateSettings rate,
    SchedulerSettings scheduler,
    boolean schedulerEnabled,
    Path registry,
    MetricsSettings metrics,
    Map<String, String> streams) {

  public EmberConfig {
    Objects.requireNonNull(ingest, "ingest");
    Objects.requireNonNull(thermal, "thermal");
    Objects.requireNonNull(fusion, "fusion");
    ConfidencePolicy.forName(confidencePolicy);
    Objects.requireNonNull(rate, "rate");
    Objects.requireNonNull(scheduler, "scheduler");
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(metrics, "metrics");
    streams = Map.copyOf(Objects.requireNonNull(streams, "streams"));
  }

  public static EmberConfig defaults() {
    return new EmberConfig(
        IngestSettings.defaults(),
        ThermalCalibration.defaults(),
        FusionSettings.defaults(),
        "mean",
        RateSettings.defaults(),
        SchedulerSettings.defaults(),
        true,
        defaultRegistryPath(),
        MetricsSettings.defaults(),
        Map.of());
  }

  public static Path defaultRegistryPath() {
    return Path.of(System.getProperty("user.home", "."), ".ember", "devices.yaml");
  }

  /**
   * Builds a configuration from flat keys, using {@link #defaults()} for anything missing.
   *
   * @param map flat configuration, e.g. from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException when any value is malformed or out of range
   */
  public static EmberConfig fromMap(Map<String, String> map) {
    ConfigValues values = new ConfigValues(map);
    EmberConfig d = defaults();

    IngestSettings di = d.ingest();
    IngestSettings ingest = new IngestSettings(
        values.text("ingest.bindHost", di.bindHost()),
        Numbers.parseInt("ingest.port", values.raw("ingest.port"), di.port(), 0, 65_535),
        Numbers.parseInt("ingest.maxConnections", values.raw("ingest.maxConnections"), di.maxConnections(), 1, 4_096),
        Numbers.parseInt("ingest.maxPacketBytes", values.raw("ingest.maxPacketBytes"), di.maxPacketBytes(), 64,
            1 << 20),
        Numbers.parseInt("ingest.readTimeoutMillis", values.raw("ingest.readTimeoutMillis"),
            di.readTimeoutMillis(), 10, 600_000),
        values.bool("ingest.useDeviceOffset", di.useDeviceOffset()),
        values.bool("ingest.autoPeriodOnConnect", di.autoPeriodOnConnect()));

    ThermalCalibration dt = d.thermal();
    ThermalCalibration thermal = new ThermalCalibration(
        values.bool("thermal.signed", dt.signed()),
        Numbers.parseDouble("thermal.scale", values.raw("thermal.scale"), dt.scale(), 1e-6d, 1_000d),
        Numbers.parseDouble("thermal.offset", values.raw("thermal.offset"), dt.offset(), -1_000d, 1_000d));

    FusionSettings df = d.fusion();
    Map<SensorChannel, ChannelLimit> limits = new EnumMap<>(SensorChannel.class);
    for (SensorChannel channel : SensorChannel.values()) {
      String prefix = "fusion." + channel.name().toLowerCase(Locale.ROOT) + ".";
      ChannelLimit fallback = df.limit(channel);
      limits.put(channel, new ChannelLimit(
          Numbers.parseDouble(prefix + "threshold", values.raw(prefix + "threshold"), fallback.threshold(),
              -1_000_000d, 1_000_000d),
          Numbers.parseDouble(prefix + "saturation", values.raw(prefix + "saturation"), fallback.saturation(),
              -1_000_000d, 1_000_000d)));
    }
    FusionSettings fusion = new FusionSettings(
        limits,
        Numbers.parseInt("fusion.minSources", values.raw("fusion.minSources"), df.minSources(), 1,
            SensorChannel.values().length),
        Numbers.parseInt("fusion.holdMillis", values.raw("fusion.holdMillis"), (int) df.holdMillis(), 0,
            3_600_000),
        Numbers.parseInt("fusion.hotCellDecayMillis", values.raw("fusion.hotCellDecayMillis"),
            (int) df.hotCellDecayMillis(), 0, 3_600_000),
        Numbers.parseInt("fusion.visionMaxAgeMillis", values.raw("fusion.visionMaxAgeMillis"),
            (int) df.visionMaxAgeMillis(), 1, 3_600_000),
        Numbers.parseInt("fusion.flameActiveValue", values.raw("fusion.flameActiveValue"), df.flameActiveValue(),
            0, 1),
        Numbers.parseInt("fusion.mailboxCapacity", values.raw("fusion.mailboxCapacity"), df.mailboxCapacity(), 1,
            65_536),
        Numbers.parseInt("fusion.workers", values.raw("fusion.workers"), df.workers(), 1, 64),
        values.bool("fusion.gasFromAdc1", df.gasFromAdc1()));
    String policy = values.text("fusion.confidencePolicy", d.confidencePolicy());

    RateSettings rate = rateFromMap(values);

    SchedulerSettings ds = d.scheduler();
    SchedulerSettings scheduler = new SchedulerSettings(
        Numbers.parseInt("scheduler.tickMillis", values.raw("scheduler.tickMillis"), (int) ds.tickMillis(), 10,
            60_000),
        Numbers.parseInt("scheduler.periodOnRetrySeconds", values.raw("scheduler.periodOnRetrySeconds"),
            ds.periodOnRetrySeconds(), 1, 3_600),
        Numbers.parseInt("scheduler.eepromRefreshSeconds", values.raw("scheduler.eepromRefreshSeconds"),
            ds.eepromRefreshSeconds(), 0, 86_400),
        Numbers.parseInt("scheduler.failureLogIntervalSeconds", values.raw("scheduler.failureLogIntervalSeconds"),
            ds.failureLogIntervalSeconds(), 0, 86_400),
        Numbers.parseInt("scheduler.dispatchThreads", values.raw("scheduler.dispatchThreads"),
            ds.dispatchThreads(), 1, 256),
        Numbers.parseInt("scheduler.connectTimeoutMillis", values.raw("scheduler.connectTimeoutMillis"),
            ds.connectTimeoutMillis(), 1, 60_000),
        Numbers.parseInt("scheduler.ackTimeoutMillis", values.raw("scheduler.ackTimeoutMillis"),
            ds.ackTimeoutMillis(), 1, 60_000));

    MetricsSettings dm = d.metrics();
    MetricsSettings metrics = new MetricsSettings(
        values.text("metrics.exporter", dm.exporter()),
        values.text("metrics.host", dm.host()),
        Numbers.parseInt("metrics.port", values.raw("metrics.port"), dm.port(), 1, 65_535),
        values.text("metrics.otlpEndpoint", dm.otlpEndpoint()));

    Map<String, String> streams = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : values.withPrefix("streams.").entrySet()) {
      String stream = Strings.requireIdentifier("stream id", entry.getKey());
      streams.put(stream, Strings.requireIdentifier("streams." + stream, entry.getValue()));
    }

    return new EmberConfig(
        ingest,
        thermal,
        fusion,
        policy,
        rate,
        scheduler,
        values.bool("scheduler.enabled", d.schedulerEnabled()),
        Path.of(values.text("registry", d.registry().toString())),
        metrics,
        streams);
  }

  static RateSettings rateFromMap(ConfigValues values) {
    RateSettings dr = RateSettings.defaults();
    return new RateSettings(
        Numbers.parseInt("rate.baseFps", values.raw("rate.baseFps"), dr.baseFps(), 1, 240),
        Numbers.parseInt("rate.minFps", values.raw("rate.minFps"), dr.minFps(), 1, 240),
        Numbers.parseInt("rate.maxFps", values.raw("rate.maxFps"), dr.maxFps(), 1, 240),
        Numbers.parseInt("rate.highWatermark", values.raw("rate.highWatermark"), dr.highWatermark(), 1, 1_000_000),
        Numbers.parseInt("rate.lowWatermark", values.raw("rate.lowWatermark"), dr.lowWatermark(), 0, 1_000_000),
        Numbers.parseInt("rate.cooldownMillis", values.raw("rate.cooldownMillis"), (int) dr.cooldownMillis(), 0,
            60_000));
  }
}
