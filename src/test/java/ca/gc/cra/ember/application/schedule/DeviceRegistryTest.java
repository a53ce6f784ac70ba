package ca.gc.cra.ember.application.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ember.domain.device.Device;
import ca.gc.cra.ember.domain.device.DeviceMode;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DeviceRegistryTest {
  private static final Device FIRST = new Device("d1", null, "10.0.0.1", 9001, "RoomA", DeviceMode.CONTINUOUS, 30);
  private static final Device SECOND = new Device("d2", "Hall", "10.0.0.1", 9002, "RoomB", DeviceMode.ON_DEMAND, 10);

  @Test
  void addPersistsAndListsInRegistrationOrder() throws IOException {
    InMemoryDeviceStore store = new InMemoryDeviceStore(List.of());
    DeviceRegistry registry = new DeviceRegistry(store);

    registry.add(FIRST);
    registry.add(SECOND);

    assertEquals(List.of(FIRST, SECOND), registry.list());
    assertEquals(List.of(FIRST, SECOND), store.stored());
    assertEquals("d1", registry.get("d1").orElseThrow().name(), "blank name defaults to id");
    assertEquals(List.of(FIRST, SECOND), registry.findByIp("10.0.0.1"));
  }

  @Test
  void duplicateIdIsRejected() throws IOException {
    DeviceRegistry registry = new DeviceRegistry(new InMemoryDeviceStore(List.of(FIRST)));
    registry.load();

    Device clash = new Device("d1", "Other", "10.0.0.9", 9001, "RoomC", DeviceMode.ON_DEMAND, 5);
    assertThrows(IllegalArgumentException.class, () -> registry.add(clash));
    assertEquals(1, registry.list().size());
  }

  @Test
  void failedWriteLeavesViewUnchanged() throws IOException {
    InMemoryDeviceStore store = new InMemoryDeviceStore(List.of(FIRST));
    DeviceRegistry registry = new DeviceRegistry(store);
    registry.load();
    store.failWrites(true);

    assertThrows(IOException.class, () -> registry.add(SECOND));
    assertThrows(IOException.class, () -> registry.remove("d1"));

    assertEquals(List.of(FIRST), registry.list());
  }

  @Test
  void removeReportsWhetherDeviceExisted() throws IOException {
    InMemoryDeviceStore store = new InMemoryDeviceStore(List.of(FIRST, SECOND));
    DeviceRegistry registry = new DeviceRegistry(store);
    registry.load();

    assertTrue(registry.remove("d1"));
    assertFalse(registry.remove("d1"));

    assertEquals(List.of(SECOND), store.stored());
    assertEquals(1, store.saves());
  }

  @Test
  void loadRejectsDuplicateIds() {
    DeviceRegistry registry = new DeviceRegistry(new InMemoryDeviceStore(List.of(FIRST, FIRST)));

    assertThrows(IllegalArgumentException.class, registry::load);
  }
}
