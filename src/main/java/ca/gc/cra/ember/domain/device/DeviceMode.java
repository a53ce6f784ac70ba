package ca.gc.cra.ember.domain.device;

import java.util.Locale;

/**
 * Reporting mode of a response device.
 */
public enum DeviceMode {
  /** Streams continuously once {@code PERIOD_ON} has been acknowledged. */
  CONTINUOUS,
  /** Reports only when polled with {@code REQUEST1}. */
  ON_DEMAND;

  /**
   * Parses a mode name, accepting {@code Continuous}, {@code OnDemand}, {@code on_demand}, and {@code on-demand}.
   *
   * @param value raw text
   * @return parsed mode
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static DeviceMode fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("mode must be Continuous or OnDemand");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
    return switch (normalized) {
      case "CONTINUOUS" -> CONTINUOUS;
      case "ONDEMAND" -> ON_DEMAND;
      default -> throw new IllegalArgumentException("mode must be Continuous or OnDemand (was " + value + ")");
    };
  }
}
