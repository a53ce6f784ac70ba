package ca.gc.cra.ember.application.schedule;

import ca.gc.cra.ember.application.port.DeviceRegistryStore;
import ca.gc.cra.ember.domain.device.Device;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory view of the registered devices, backed by a {@link DeviceRegistryStore}.
 *
 * <p>Reads are concurrent; add, remove, and reload take a single writer lock and persist before the lock is
 * released, so a failed write leaves the in-memory view unchanged.</p>
 */
public final class DeviceRegistry {
  private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

  private final DeviceRegistryStore store;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Device> devices = new LinkedHashMap<>();

  public DeviceRegistry(DeviceRegistryStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Replaces the in-memory view with the stored devices.
   *
   * @return number of devices loaded
   * @throws IOException when the store cannot be read
   * @throws IllegalArgumentException when the store holds an invalid device or a duplicate id
   */
  public int load() throws IOException {
    List<Device> loaded = store.load();
    Map<String, Device> next = new LinkedHashMap<>();
    for (Device device : loaded) {
      if (next.putIfAbsent(device.id(), device) != null) {
        throw new IllegalArgumentException("duplicate device id " + device.id());
      }
    }
    lock.writeLock().lock();
    try {
      devices.clear();
      devices.putAll(next);
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Loaded {} device(s) from registry", next.size());
    return next.size();
  }

  /**
   * Registers a device and persists the registry.
   *
   * @param device validated device
   * @throws IOException when the store cannot be written
   * @throws IllegalArgumentException when the id is already registered
   */
  public void add(Device device) throws IOException {
    Objects.requireNonNull(device, "device");
    lock.writeLock().lock();
    try {
      if (devices.containsKey(device.id())) {
        throw new IllegalArgumentException("device id already registered: " + device.id());
      }
      List<Device> next = new ArrayList<>(devices.values());
      next.add(device);
      store.save(next);
      devices.put(device.id(), device);
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Registered device {} ({}:{}, {})", device.id(), device.ip(), device.port(), device.mode());
  }

  /**
   * Removes a device and persists the registry.
   *
   * @param deviceId device id
   * @return {@code true} when the device existed
   * @throws IOException when the store cannot be written
   */
  public boolean remove(String deviceId) throws IOException {
    lock.writeLock().lock();
    try {
      if (!devices.containsKey(deviceId)) {
        return false;
      }
      List<Device> next = new ArrayList<>(devices.values());
      next.removeIf(device -> device.id().equals(deviceId));
      store.save(next);
      devices.remove(deviceId);
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Removed device {}", deviceId);
    return true;
  }

  public List<Device> list() {
    lock.readLock().lock();
    try {
      return List.copyOf(devices.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<Device> get(String deviceId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(devices.get(deviceId));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Devices registered under an address.
   *
   * @param ip IP literal
   * @return matching devices in registration order
   */
  public List<Device> findByIp(String ip) {
    lock.readLock().lock();
    try {
      List<Device> matches = new ArrayList<>();
      for (Device device : devices.values()) {
        if (device.ip().equals(ip)) {
          matches.add(device);
        }
      }
      return matches;
    } finally {
      lock.readLock().unlock();
    }
  }
}
