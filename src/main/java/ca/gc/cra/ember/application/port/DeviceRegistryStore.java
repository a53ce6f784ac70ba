package ca.gc.cra.ember.application.port;

import ca.gc.cra.ember.domain.device.Device;
import java.io.IOException;
import java.util.List;

/**
 * Durable storage for the device registry.
 */
public interface DeviceRegistryStore {
  /**
   * Loads all devices.
   *
   * @return devices in stored order; empty when nothing is stored yet
   * @throws IOException when the backing store cannot be read
   * @throws IllegalArgumentException when a stored device fails validation
   */
  List<Device> load() throws IOException;

  /**
   * Replaces the stored devices.
   *
   * @param devices devices to persist
   * @throws IOException when the backing store cannot be written
   */
  void save(List<Device> devices) throws IOException;
}
