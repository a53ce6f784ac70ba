package ca.gc.cra.ember.domain.record;

import java.util.Optional;

/**
 * Identity announcement from a field unit. A {@code #serialno} packet carries only the serial and a
 * {@code #locid} packet carries only the location, so either component may be absent, never both.
 *
 * @param serial unit serial number, or {@code null}
 * @param locationId announced location id, or {@code null}
 */
public record Identity(String serial, String locationId) implements DecodedRecord {

  public Identity {
    serial = blankToNull(serial);
    locationId = blankToNull(locationId);
    if (serial == null && locationId == null) {
      throw new IllegalArgumentException("identity requires a serial or a location id");
    }
  }

  public static Identity ofSerial(String serial) {
    return new Identity(serial, null);
  }

  public static Identity ofLocation(String locationId) {
    return new Identity(null, locationId);
  }

  public Optional<String> serialValue() {
    return Optional.ofNullable(serial);
  }

  public Optional<String> locationValue() {
    return Optional.ofNullable(locationId);
  }

  @Override
  public String kind() {
    return "identity";
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
