package ca.gc.cra.ember.infrastructure.device;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ember.domain.device.Device;
import ca.gc.cra.ember.domain.device.DeviceMode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlDeviceRegistryStoreTest {
  @TempDir
  Path tempDir;

  @Test
  void missingFileIsEmptyRegistry() throws IOException {
    YamlDeviceRegistryStore store = new YamlDeviceRegistryStore(tempDir.resolve("devices.yaml"));

    assertTrue(store.load().isEmpty());
  }

  @Test
  void savedDevicesLoadBack() throws IOException {
    Path file = tempDir.resolve("state").resolve("devices.yaml");
    YamlDeviceRegistryStore store = new YamlDeviceRegistryStore(file);
    List<Device> devices = List.of(
        new Device("pfds-1", "Kitchen suppressor", "192.168.1.50", 9001, "RoomA", DeviceMode.CONTINUOUS, 30),
        new Device("siren-2", "Siren", "fe80::1", 9100, "RoomB", DeviceMode.ON_DEMAND, 10));

    store.save(devices);

    assertEquals(devices, store.load());
    String yaml = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(yaml.contains("mode: Continuous"));
    assertTrue(yaml.contains("locationId: RoomB"));
    assertFalse(Files.exists(tempDir.resolve("state").resolve("devices.yaml.tmp")));
  }

  @Test
  void handWrittenEntriesUseDefaults() throws IOException {
    Path file = tempDir.resolve("devices.yaml");
    Files.writeString(file, """
        devices:
          - id: pfds-1
            ip: 192.168.1.50
            locationId: RoomA
            mode: on-demand
        """, StandardCharsets.UTF_8);

    Device device = new YamlDeviceRegistryStore(file).load().get(0);

    assertEquals(Device.DEFAULT_PORT, device.port());
    assertEquals(Device.DEFAULT_POLL_SECONDS, device.pollIntervalSeconds());
    assertEquals("pfds-1", device.name());
    assertEquals(DeviceMode.ON_DEMAND, device.mode());
  }

  @Test
  void invalidEntryNamesItsIndex() throws IOException {
    Path file = tempDir.resolve("devices.yaml");
    Files.writeString(file, """
        devices:
          - id: ok-1
            ip: 10.0.0.1
            locationId: RoomA
            mode: Continuous
          - id: bad-1
            ip: not-an-address
            locationId: RoomA
            mode: Continuous
        """, StandardCharsets.UTF_8);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new YamlDeviceRegistryStore(file).load());
    assertTrue(ex.getMessage().startsWith("devices[1]"), ex.getMessage());
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path file = tempDir.resolve("devices.yaml");
    Files.writeString(file, "devices: [unclosed", StandardCharsets.UTF_8);

    assertThrows(IllegalArgumentException.class, () -> new YamlDeviceRegistryStore(file).load());
  }
}
