package ca.gc.cra.ember.config;

import ca.gc.cra.ember.application.fusion.ChannelLimit;
import ca.gc.cra.ember.application.rate.RateSettings;
import ca.gc.cra.ember.domain.fusion.SensorChannel;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each EMBER CLI command.
 *
 * <p>The defaults are derived from the settings records, so the records remain the single source of truth.</p>
 */
public final class DefaultsForMode {

  private DefaultsForMode() {}

  /**
   * Returns the flat defaults for a command.
   *
   * @param command {@code serve}, {@code devices}, {@code simulate}, or {@code ratesim}
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("verbose", "false");
    defaults.putAll(switch (normalized) {
      case "serve" -> buildServeDefaults();
      case "devices" -> Map.of("registry", EmberConfig.defaultRegistryPath().toString());
      case "simulate" -> buildSimulateDefaults();
      case "ratesim" -> buildRateDefaults();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildServeDefaults() {
    EmberConfig d = EmberConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("ingest.bindHost", d.ingest().bindHost());
    map.put("ingest.port", Integer.toString(d.ingest().port()));
    map.put("ingest.maxConnections", Integer.toString(d.ingest().maxConnections()));
    map.put("ingest.maxPacketBytes", Integer.toString(d.ingest().maxPacketBytes()));
    map.put("ingest.readTimeoutMillis", Integer.toString(d.ingest().readTimeoutMillis()));
    map.put("ingest.useDeviceOffset", Boolean.toString(d.ingest().useDeviceOffset()));
    map.put("ingest.autoPeriodOnConnect", Boolean.toString(d.ingest().autoPeriodOnConnect()));
    map.put("thermal.signed", Boolean.toString(d.thermal().signed()));
    map.put("thermal.scale", Double.toString(d.thermal().scale()));
    map.put("thermal.offset", Double.toString(d.thermal().offset()));
    for (SensorChannel channel : SensorChannel.values()) {
      String prefix = "fusion." + channel.name().toLowerCase(Locale.ROOT) + ".";
      ChannelLimit limit = d.fusion().limit(channel);
      map.put(prefix + "threshold", Double.toString(limit.threshold()));
      map.put(prefix + "saturation", Double.toString(limit.saturation()));
    }
    map.put("fusion.minSources", Integer.toString(d.fusion().minSources()));
    map.put("fusion.holdMillis", Long.toString(d.fusion().holdMillis()));
    map.put("fusion.hotCellDecayMillis", Long.toString(d.fusion().hotCellDecayMillis()));
    map.put("fusion.visionMaxAgeMillis", Long.toString(d.fusion().visionMaxAgeMillis()));
    map.put("fusion.flameActiveValue", Integer.toString(d.fusion().flameActiveValue()));
    map.put("fusion.mailboxCapacity", Integer.toString(d.fusion().mailboxCapacity()));
    map.put("fusion.workers", Integer.toString(d.fusion().workers()));
    map.put("fusion.gasFromAdc1", Boolean.toString(d.fusion().gasFromAdc1()));
    map.put("fusion.confidencePolicy", d.confidencePolicy());
    map.putAll(buildRateDefaults());
    map.put("scheduler.enabled", Boolean.toString(d.schedulerEnabled()));
    map.put("scheduler.tickMillis", Long.toString(d.scheduler().tickMillis()));
    map.put("scheduler.periodOnRetrySeconds", Integer.toString(d.scheduler().periodOnRetrySeconds()));
    map.put("scheduler.eepromRefreshSeconds", Integer.toString(d.scheduler().eepromRefreshSeconds()));
    map.put("scheduler.failureLogIntervalSeconds", Integer.toString(d.scheduler().failureLogIntervalSeconds()));
    map.put("scheduler.dispatchThreads", Integer.toString(d.scheduler().dispatchThreads()));
    map.put("scheduler.connectTimeoutMillis", Integer.toString(d.scheduler().connectTimeoutMillis()));
    map.put("scheduler.ackTimeoutMillis", Integer.toString(d.scheduler().ackTimeoutMillis()));
    map.put("registry", d.registry().toString());
    map.put("metrics.exporter", d.metrics().exporter());
    map.put("metrics.host", d.metrics().host());
    map.put("metrics.port", Integer.toString(d.metrics().port()));
    map.put("metrics.otlpEndpoint", d.metrics().otlpEndpoint());
    return map;
  }

  private static Map<String, String> buildSimulateDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("host", "127.0.0.1");
    map.put("port", "9000");
    map.put("serial", "SIM001");
    map.put("format", "SEPARATE");
    map.put("connections", "1");
    map.put("packets", "100");
    map.put("rate", "20");
    map.put("hotspot", "35");
    map.put("seed", "42");
    return map;
  }

  private static Map<String, String> buildRateDefaults() {
    RateSettings d = RateSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("rate.baseFps", Integer.toString(d.baseFps()));
    map.put("rate.minFps", Integer.toString(d.minFps()));
    map.put("rate.maxFps", Integer.toString(d.maxFps()));
    map.put("rate.highWatermark", Integer.toString(d.highWatermark()));
    map.put("rate.lowWatermark", Integer.toString(d.lowWatermark()));
    map.put("rate.cooldownMillis", Long.toString(d.cooldownMillis()));
    return map;
  }
}
