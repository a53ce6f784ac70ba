package ca.gc.cra.ember.infrastructure.net;

import ca.gc.cra.ember.domain.record.ThermalCalibration;
import java.util.Objects;

/**
 * Per-connection state. Owned by the connection thread; discarded when the socket closes.
 *
 * <p>The location binding is set by the first explicit {@code #locid} packet and never changes afterwards.
 * Until then, packets without a location fall back to the peer address, which does not bind.</p>
 */
final class ConnectionContext {
  private final String peerAddress;
  private String boundLocation;
  private String serial;
  private ThermalCalibration calibration;
  private long received;
  private long errors;

  ConnectionContext(String peerAddress, ThermalCalibration calibration) {
    this.peerAddress = Objects.requireNonNull(peerAddress, "peerAddress");
    this.calibration = Objects.requireNonNull(calibration, "calibration");
  }

  /**
   * Binds the connection to a location.
   *
   * @param locationId announced location
   * @return {@code true} if the connection is now bound to {@code locationId}; {@code false} if it was already
   *     bound to a different one
   */
  boolean bind(String locationId) {
    if (boundLocation == null) {
      boundLocation = locationId;
      return true;
    }
    return boundLocation.equals(locationId);
  }

  String resolve(String packetLocation) {
    if (packetLocation != null) {
      return packetLocation;
    }
    return effectiveLocation();
  }

  String effectiveLocation() {
    return boundLocation != null ? boundLocation : peerAddress;
  }

  String boundLocation() {
    return boundLocation;
  }

  String peerAddress() {
    return peerAddress;
  }

  String serial() {
    return serial;
  }

  void serial(String value) {
    this.serial = value;
  }

  ThermalCalibration calibration() {
    return calibration;
  }

  void calibration(ThermalCalibration value) {
    this.calibration = Objects.requireNonNull(value, "calibration");
  }

  void countReceived() {
    received++;
  }

  void countError() {
    errors++;
  }

  long received() {
    return received;
  }

  long errors() {
    return errors;
  }
}
