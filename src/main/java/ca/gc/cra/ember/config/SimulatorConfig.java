package ca.gc.cra.ember.config;

import ca.gc.cra.ember.domain.record.PacketFormat;
import ca.gc.cra.ember.validation.Net;
import ca.gc.cra.ember.validation.Numbers;
import ca.gc.cra.ember.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of the {@code simulate} command, which impersonates one or more field units.
 *
 * @param host ingestion host
 * @param port ingestion port
 * @param location location announced by the first unit; further units append {@code -2}, {@code -3}, ...
 * @param serial serial announced by the first unit, suffixed the same way
 * @param format wire variant of frames and samples
 * @param connections concurrent simulated units
 * @param packets frames plus samples sent by each unit after its identity packets
 * @param rate packets per second per unit
 * @param hotspotCelsius peak temperature painted into every frame
 * @param seed random seed for reproducible readings
 */
public record SimulatorConfig(
    String host,
    int port,
    String location,
    String serial,
    PacketFormat format,
    int connections,
    int packets,
    double rate,
    double hotspotCelsius,
    long seed) {

  public SimulatorConfig {
    host = Net.requireHost("host", host);
    Net.requirePort("port", port, false);
    Objects.requireNonNull(format, "format");
    if (format != PacketFormat.NO_LOC && location == null) {
      throw new IllegalArgumentException("location is required unless format=NO_LOC");
    }
    if (location != null) {
      location = Strings.requireIdentifier("location", location);
    }
    serial = Strings.requireIdentifier("serial", serial);
    Numbers.requireRange("connections", connections, 1, 1_000);
    Numbers.requireRange("packets", packets, 0, 10_000_000);
    Numbers.requireRange("rate", rate, 0.1d, 10_000d);
    Numbers.requireRange("hotspot", hotspotCelsius, -40d, 300d);
  }

  public static SimulatorConfig fromMap(Map<String, String> map) {
    ConfigValues values = new ConfigValues(map);
    PacketFormat format;
    String rawFormat = values.text("format", PacketFormat.SEPARATE.name()).toUpperCase(Locale.ROOT);
    try {
      format = PacketFormat.valueOf(rawFormat);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("format must be SEPARATE, EMBEDDED, CONTINUOUS or NO_LOC (was "
          + rawFormat + ")", ex);
    }
    String seedRaw = values.text("seed", "42");
    long seed;
    try {
      seed = Long.parseLong(seedRaw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("seed must be an integer (was " + seedRaw + ")", ex);
    }
    return new SimulatorConfig(
        values.text("host", "127.0.0.1"),
        Numbers.parseInt("port", values.raw("port"), 9000, 1, 65_535),
        values.text("location", null),
        values.text("serial", "SIM001"),
        format,
        Numbers.parseInt("connections", values.raw("connections"), 1, 1, 1_000),
        Numbers.parseInt("packets", values.raw("packets"), 100, 0, 10_000_000),
        Numbers.parseDouble("rate", values.raw("rate"), 20d, 0.1d, 10_000d),
        Numbers.parseDouble("hotspot", values.raw("hotspot"), 35d, -40d, 300d),
        seed);
  }

  /**
   * Location announced by unit {@code index} (0-based).
   *
   * @param index unit index
   * @return location id, or {@code null} for {@link PacketFormat#NO_LOC} without a location
   */
  public String locationFor(int index) {
    if (location == null) {
      return null;
    }
    return index == 0 ? location : location + "-" + (index + 1);
  }

  public String serialFor(int index) {
    return index == 0 ? serial : serial + "-" + (index + 1);
  }
}
