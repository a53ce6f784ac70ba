package ca.gc.cra.ember.domain.device;

import ca.gc.cra.ember.validation.Net;
import ca.gc.cra.ember.validation.Numbers;
import ca.gc.cra.ember.validation.Strings;
import java.util.Objects;

/**
 * Registered response device. Instances only exist in a validated state.
 *
 * @param id unique device id
 * @param name display name
 * @param ip IPv4 or IPv6 literal of the device command port
 * @param port TCP command port
 * @param locationId monitored location the device serves
 * @param mode reporting mode
 * @param pollIntervalSeconds {@code REQUEST1} cadence, 1..3600 seconds
 * @since 0.1.0
 */
public record Device(
    String id,
    String name,
    String ip,
    int port,
    String locationId,
    DeviceMode mode,
    int pollIntervalSeconds) {
  public static final int DEFAULT_PORT = 9001;
  public static final int DEFAULT_POLL_SECONDS = 10;
  public static final int MIN_POLL_SECONDS = 1;
  public static final int MAX_POLL_SECONDS = 3_600;

  /**
   * Validates every field.
   *
   * @throws IllegalArgumentException when a field is blank, malformed, or out of range
   */
  public Device {
    id = Strings.requireIdentifier("device.id", id);
    name = name == null || name.isBlank() ? id : Strings.requirePrintableAscii("device.name", name, 128);
    ip = Net.requireIpLiteral("device.ip", ip);
    Net.requirePort("device.port", port, false);
    locationId = Strings.requireIdentifier("device.locationId", locationId);
    mode = Objects.requireNonNull(mode, "device.mode");
    Numbers.requireRange("device.pollIntervalSeconds", pollIntervalSeconds, MIN_POLL_SECONDS, MAX_POLL_SECONDS);
  }

  public long pollIntervalMillis() {
    return pollIntervalSeconds * 1_000L;
  }

  public boolean continuous() {
    return mode == DeviceMode.CONTINUOUS;
  }
}
