package ca.gc.cra.ember.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ember.application.port.ClockPort;
import ca.gc.cra.ember.application.port.CommandTransport;
import ca.gc.cra.ember.application.port.DeviceRegistryStore;
import ca.gc.cra.ember.application.port.MetricsPort;
import ca.gc.cra.ember.domain.device.Device;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  private static EmberConfig config(Map<String, String> overrides) {
    Map<String, String> map = new HashMap<>(DefaultsForMode.asFlatMap("serve"));
    map.put("ingest.bindHost", "127.0.0.1");
    map.put("ingest.port", "0");
    map.put("metrics.exporter", "none");
    map.putAll(overrides);
    return EmberConfig.fromMap(map);
  }

  private static final class EmptyStore implements DeviceRegistryStore {
    private int loads;

    @Override
    public List<Device> load() {
      loads++;
      return new ArrayList<>();
    }

    @Override
    public void save(List<Device> devices) {
    }
  }

  private static final CommandTransport UNUSED_TRANSPORT = (device, command) -> {
    throw new AssertionError("no devices are registered");
  };

  @Test
  void governorFeedsMailboxDepthOfMappedLocation() {
    AtomicLong now = new AtomicLong(1_000L);
    ClockPort clock = now::get;
    EmberConfig config = config(Map.of("scheduler.enabled", "false", "streams.cam1", "RoomA"));

    try (CompositionRoot root =
        new CompositionRoot(config, MetricsPort.NO_OP, clock, new EmptyStore(), UNUSED_TRANSPORT)) {
      assertEquals(1, root.governStreamRates());
      assertEquals(26, root.rateController().currentFps("cam1"));
      assertEquals(0, root.fusionDispatcher().depth("RoomA"));
    }
  }

  @Test
  void startLoadsRegistryAndBindsEphemeralPort() throws Exception {
    EmptyStore store = new EmptyStore();
    EmberConfig config = config(Map.of());

    try (CompositionRoot root =
        new CompositionRoot(config, MetricsPort.NO_OP, ClockPort.SYSTEM, store, UNUSED_TRANSPORT)) {
      root.start();

      assertEquals(1, store.loads);
      assertTrue(root.ingestionServer().port() > 0);
      assertThrows(IllegalStateException.class, root::start);
    }
  }

  @Test
  void disabledSchedulerSkipsRegistry() throws Exception {
    EmptyStore store = new EmptyStore();
    EmberConfig config = config(Map.of("scheduler.enabled", "false"));

    try (CompositionRoot root =
        new CompositionRoot(config, MetricsPort.NO_OP, ClockPort.SYSTEM, store, UNUSED_TRANSPORT)) {
      root.start();
      assertEquals(0, store.loads);
    }
  }
}
