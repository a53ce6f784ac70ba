package ca.gc.cra.ember.domain.device;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DeviceTest {

  @Test
  void validDeviceNormalizesFields() {
    Device device = new Device(" pfds-1 ", " ", "10.0.0.5", 9001, "RoomA", DeviceMode.CONTINUOUS, 30);

    assertEquals("pfds-1", device.id());
    assertEquals("pfds-1", device.name());
    assertEquals(30_000L, device.pollIntervalMillis());
    assertTrue(device.continuous());
  }

  @Test
  void rejectsInvalidFields() {
    assertThrows(IllegalArgumentException.class,
        () -> new Device("pfds-1", null, "unit.local", 9001, "RoomA", DeviceMode.ON_DEMAND, 10));
    assertThrows(IllegalArgumentException.class,
        () -> new Device("pfds-1", null, "10.0.0.5", 0, "RoomA", DeviceMode.ON_DEMAND, 10));
    assertThrows(IllegalArgumentException.class,
        () -> new Device("pfds-1", null, "10.0.0.5", 9001, "RoomA", DeviceMode.ON_DEMAND, 0));
    assertThrows(IllegalArgumentException.class,
        () -> new Device("pfds-1", null, "10.0.0.5", 9001, "RoomA", DeviceMode.ON_DEMAND, 3_601));
    assertThrows(IllegalArgumentException.class,
        () -> new Device("pfds/1", null, "10.0.0.5", 9001, "RoomA", DeviceMode.ON_DEMAND, 10));
    assertThrows(NullPointerException.class,
        () -> new Device("pfds-1", null, "10.0.0.5", 9001, "RoomA", null, 10));
  }

  @Test
  void modeParsingIsLenient() {
    assertEquals(DeviceMode.ON_DEMAND, DeviceMode.fromString("OnDemand"));
    assertEquals(DeviceMode.ON_DEMAND, DeviceMode.fromString("on-demand"));
    assertEquals(DeviceMode.CONTINUOUS, DeviceMode.fromString(" continuous "));
    assertThrows(IllegalArgumentException.class, () -> DeviceMode.fromString("periodic"));
  }

  @Test
  void commandsAreNewlineTerminated() {
    assertEquals("PERIOD_ON\n", CommandType.PERIOD_ON.wireLine());
    assertEquals("REQUEST1\n", CommandType.REQUEST1.wireLine());
  }
}
