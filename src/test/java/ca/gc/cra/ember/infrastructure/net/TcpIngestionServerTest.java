package ca.gc.cra.ember.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ember.application.fusion.FusionDispatcher;
import ca.gc.cra.ember.application.fusion.FusionSettings;
import ca.gc.cra.ember.application.fusion.FusionSnapshot;
import ca.gc.cra.ember.application.fusion.MeanExceedancePolicy;
import ca.gc.cra.ember.application.fusion.SensorFusionEngine;
import ca.gc.cra.ember.application.port.ClockPort;
import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.config.SimulatorConfig;
import ca.gc.cra.ember.domain.record.PacketFormat;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.domain.record.ThermalCalibration;
import ca.gc.cra.ember.infrastructure.metrics.MetricsCollector;
import ca.gc.cra.ember.infrastructure.protocol.SensorPacketDecoder;
import ca.gc.cra.ember.infrastructure.protocol.SensorPacketEncoder;
import ca.gc.cra.ember.support.Packets;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TcpIngestionServerTest {
  private MetricsCollector metrics;
  private SensorFusionEngine engine;
  private FusionDispatcher dispatcher;
  private TcpIngestionServer server;

  @BeforeEach
  void setUp() throws IOException {
    metrics = new MetricsCollector();
    engine = new SensorFusionEngine(FusionSettings.defaults(), new MeanExceedancePolicy(), ClockPort.SYSTEM, metrics);
    dispatcher = new FusionDispatcher(engine, metrics);
    server = new TcpIngestionServer(
        new IngestSettings("127.0.0.1", 0, 16, 16_384, 100, false, false),
        new SensorPacketDecoder(ThermalCalibration.defaults(), ClockPort.SYSTEM),
        dispatcher,
        metrics,
        ClockPort.SYSTEM);
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.close();
    dispatcher.close();
  }

  @Test
  void fieldUnitSessionReachesFusion() throws Exception {
    List<String> peers = new CopyOnWriteArrayList<>();
    server.addConnectionListener(peers::add);

    try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.port())) {
      OutputStream out = socket.getOutputStream();
      out.write(Packets.ascii("#serialno:SIM001!\n#locid:RoomA!\n"));
      out.write(SensorPacketEncoder.encodeLine(PacketFormat.SEPARATE, "RoomA", Packets.uniformFrame(24.0)));
      out.write(SensorPacketEncoder.encodeLine(PacketFormat.SEPARATE, "RoomA", new SensorSample(1734, 2293, true, 0L)));
      out.flush();

      await(() -> metrics.counter(MetricNames.SAMPLES_SENSOR, "RoomA") == 1L && dispatcher.isIdle()
          && engine.snapshot("RoomA").map(FusionSnapshot::samplesApplied).orElse(0L) == 1L);
    }

    assertEquals(1L, metrics.counter(MetricNames.FRAMES_THERMAL, "RoomA"));
    assertEquals(0L, metrics.total(MetricNames.PACKETS_ERRORS));
    assertEquals(4L, metrics.counter(MetricNames.PACKETS_RECEIVED, "RoomA"));
    FusionSnapshot snapshot = engine.snapshot("RoomA").orElseThrow();
    assertTrue(snapshot.flame());
    assertEquals("SIM001", snapshot.serial());
    assertEquals(24.0, snapshot.temperatureCelsius(), 0.01);
    assertTrue(snapshot.lastResult().alarm());
    assertEquals(2, snapshot.lastResult().sourcesTriggered());
    assertEquals(List.of("127.0.0.1"), peers);
  }

  @Test
  void malformedPacketsAreCountedAndConnectionSurvives() throws Exception {
    try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.port())) {
      OutputStream out = socket.getOutputStream();
      out.write(Packets.ascii("#locid:RoomB!\n#Sensor:RoomB:ADC1=12!\ngarbage\n"));
      out.write(SensorPacketEncoder.encodeLine(PacketFormat.SEPARATE, "RoomB", new SensorSample(10, 20, false, 0L)));
      out.flush();

      await(() -> metrics.counter(MetricNames.SAMPLES_SENSOR, "RoomB") == 1L);
    }

    assertEquals(2L, metrics.counter(MetricNames.PACKETS_ERRORS, "RoomB"));
    assertEquals(2L, metrics.counter(MetricNames.PACKETS_RECEIVED, "RoomB"));
  }

  @Test
  void refusedLocationChangeStaysOnBoundLocation() throws Exception {
    try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.port())) {
      OutputStream out = socket.getOutputStream();
      out.write(Packets.ascii("#locid:RoomA!\n#locid:RoomB!\n"));
      out.write(SensorPacketEncoder.encodeLine(PacketFormat.NO_LOC, null, new SensorSample(10, 20, false, 0L)));
      out.flush();

      await(() -> metrics.counter(MetricNames.SAMPLES_SENSOR, "RoomA") == 1L && dispatcher.isIdle());
    }

    assertEquals(3L, metrics.counter(MetricNames.PACKETS_RECEIVED, "RoomA"));
    assertEquals(0L, metrics.counter(MetricNames.PACKETS_RECEIVED, "RoomB"));
    assertTrue(engine.snapshot("RoomB").isEmpty());
  }

  @Test
  void packetsWithoutLocationFallBackToPeerAddress() throws Exception {
    try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), server.port())) {
      OutputStream out = socket.getOutputStream();
      out.write(SensorPacketEncoder.encodeLine(PacketFormat.NO_LOC, null, new SensorSample(10, 20, false, 0L)));
      out.flush();

      await(() -> metrics.counter(MetricNames.SAMPLES_SENSOR, "127.0.0.1") == 1L);
    }
  }

  @Test
  void concurrentSimulatedUnitsLoseNothing() throws Exception {
    SimulatorConfig config = new SimulatorConfig(
        "127.0.0.1", server.port(), "Load", "SIM", PacketFormat.SEPARATE, 10, 98, 20d, 30d, 7L);

    FieldUnitSimulator.Report report = new FieldUnitSimulator(config).run();

    assertEquals(10, report.unitsCompleted());
    assertEquals(980L, report.packetsSent());
    await(() -> metrics.total(MetricNames.PACKETS_RECEIVED) == 1_000L);
    assertEquals(0L, metrics.total(MetricNames.PACKETS_ERRORS));
    assertEquals(490L, metrics.total(MetricNames.FRAMES_THERMAL));
    assertEquals(490L, metrics.total(MetricNames.SAMPLES_SENSOR));
    assertEquals(100L, metrics.counter(MetricNames.PACKETS_RECEIVED, "Load-10"));
    assertEquals(0L, metrics.total(MetricNames.CONNECTIONS_REJECTED));
  }

  @Test
  void bindFailureSurfacesFromStart() throws IOException {
    try (ServerSocket occupied = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
      TcpIngestionServer clash = new TcpIngestionServer(
          new IngestSettings("127.0.0.1", occupied.getLocalPort(), 4, 1_024, 100, false, false),
          new SensorPacketDecoder(ThermalCalibration.defaults(), ClockPort.SYSTEM),
          dispatcher,
          metrics,
          ClockPort.SYSTEM);

      assertThrows(IOException.class, clash::start);
      assertFalse(clash.isRunning());
    }
  }

  @Test
  void startTwiceIsRejected() {
    assertThrows(IllegalStateException.class, server::start);
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + 10_000_000_000L;
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 10s");
      }
      Thread.sleep(10L);
    }
  }
}
