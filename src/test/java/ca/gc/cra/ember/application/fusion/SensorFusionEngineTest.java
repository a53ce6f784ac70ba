package ca.gc.cra.ember.application.fusion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.domain.fusion.FusionResult;
import ca.gc.cra.ember.domain.fusion.SensorChannel;
import ca.gc.cra.ember.domain.record.Identity;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.infrastructure.metrics.MetricsCollector;
import ca.gc.cra.ember.support.ManualClock;
import ca.gc.cra.ember.support.Packets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SensorFusionEngineTest {
  private ManualClock clock;
  private MetricsCollector metrics;
  private SensorFusionEngine engine;

  @BeforeEach
  void setUp() {
    clock = new ManualClock(10_000L);
    metrics = new MetricsCollector(clock);
    engine = new SensorFusionEngine(FusionSettings.defaults(), new MeanExceedancePolicy(), clock, metrics);
  }

  @Test
  void twoTriggeredSourcesRaiseAlarm() {
    FusionResult result = engine.fuse("RoomA", 60.0, 1_200.0, 0.0, 0.0, 0.0);

    assertTrue(result.alarm());
    assertEquals(2, result.sourcesTriggered());
    assertEquals(EnumSet.of(SensorChannel.TEMPERATURE, SensorChannel.GAS), result.contributing());
    assertEquals(0.5, result.confidence(), 1e-9);
    assertFalse(result.held());
    assertEquals(1L, metrics.counter(MetricNames.FUSION_ALARMS, "RoomA"));
  }

  @Test
  void singleSourceDoesNotAlarm() {
    FusionResult result = engine.fuse("RoomA", 60.0, 0.0, 0.0, 0.0, 0.0);

    assertFalse(result.alarm());
    assertEquals(1, result.sourcesTriggered());
    assertEquals(0L, metrics.counter(MetricNames.FUSION_ALARMS, "RoomA"));
  }

  @Test
  void readingAtThresholdTriggersWithFloorConfidence() {
    FusionResult result = engine.fuse("RoomA", 40.0, 400.0, 0.0, 0.0, 0.0);

    assertTrue(result.alarm());
    assertEquals(SensorFusionEngine.TRIGGER_FLOOR, result.confidence(), 1e-9);
  }

  @Test
  void noTriggeredChannelGivesZeroConfidence() {
    FusionResult result = engine.fuse("RoomA", 20.0, 0.0, 0.0, 0.0, 0.1);

    assertFalse(result.alarm());
    assertEquals(0, result.sourcesTriggered());
    assertEquals(0.0, result.confidence(), 0.0);
  }

  @Test
  void alarmDecisionIsHeldUntilHoldExpires() {
    assertTrue(engine.fuse("RoomA", 80.0, 2_000.0, 0.0, 0.0, 0.0).alarm());

    clock.advance(1_000L);
    FusionResult held = engine.fuse("RoomA", 20.0, 0.0, 0.0, 0.0, 0.0);
    assertTrue(held.alarm());
    assertTrue(held.held());
    assertEquals(clock.nowMillis(), held.evaluatedAtMillis());

    clock.advance(4_000L);
    FusionResult released = engine.fuse("RoomA", 20.0, 0.0, 0.0, 0.0, 0.0);
    assertFalse(released.alarm());
    assertFalse(released.held());
    assertEquals(1L, metrics.counter(MetricNames.FUSION_ALARMS, "RoomA"));
  }

  @Test
  void holdIsPerLocation() {
    engine.fuse("RoomA", 80.0, 2_000.0, 0.0, 0.0, 0.0);

    FusionResult other = engine.fuse("RoomB", 20.0, 0.0, 0.0, 0.0, 0.0);

    assertFalse(other.alarm());
    assertFalse(other.held());
  }

  @Test
  void rejectsNonFiniteAndOutOfRangeInputs() {
    assertThrows(IllegalArgumentException.class, () -> engine.fuse("RoomA", Double.NaN, 0, 0, 0, 0));
    assertThrows(IllegalArgumentException.class,
        () -> engine.fuse("RoomA", 20, Double.POSITIVE_INFINITY, 0, 0, 0));
    assertThrows(IllegalArgumentException.class, () -> engine.fuse("RoomA", 20, 0, 0, 0, 1.5));
    assertThrows(IllegalArgumentException.class, () -> engine.fuse(" ", 20, 0, 0, 0, 0.5));
    assertThrows(IllegalArgumentException.class, () -> engine.submitVision("RoomA", -0.1));
  }

  @Test
  void hotCellStaysHotForDecayWindow() {
    engine.onRecord("RoomA", Packets.frameWithHotspot(24.0, 17, 60.0));
    assertEquals(60.0, engine.snapshot("RoomA").orElseThrow().temperatureCelsius(), 0.01);

    clock.advance(1_000L);
    engine.onRecord("RoomA", Packets.uniformFrame(24.0));
    assertEquals(60.0, engine.snapshot("RoomA").orElseThrow().temperatureCelsius(), 0.01);
    assertEquals(1, engine.snapshot("RoomA").orElseThrow().hotCells());

    clock.advance(4_000L);
    assertEquals(1, engine.snapshot("RoomA").orElseThrow().hotCells());

    clock.advance(1L);
    engine.onRecord("RoomA", Packets.uniformFrame(24.0));
    FusionSnapshot snapshot = engine.snapshot("RoomA").orElseThrow();
    assertEquals(24.0, snapshot.temperatureCelsius(), 0.01);
    assertEquals(0, snapshot.hotCells());
    assertEquals(3L, snapshot.framesApplied());
  }

  @Test
  void retriggeringExtendsHotCellDeadline() {
    HotCellGrid grid = new HotCellGrid(5_000L);
    grid.update(Packets.frameWithHotspot(24.0, 3, 50.0), 40.0, 1_000L);
    grid.update(Packets.frameWithHotspot(24.0, 3, 45.0), 40.0, 3_000L);

    assertEquals(8_000L, grid.deadline(3));
    assertTrue(grid.isHot(3, 8_000L));
    assertFalse(grid.isHot(3, 8_001L));
    assertEquals(45.0, grid.hottest(4_000L), 0.01);
    assertTrue(Double.isNaN(grid.hottest(9_000L)));
  }

  @Test
  void flameFlagTriggersFlameChannel() {
    FusionResult result = engine.onRecord("RoomA", new SensorSample(0, 0, true, 0L)).orElseThrow();

    assertEquals(EnumSet.of(SensorChannel.FLAME), result.contributing());
    assertEquals(1.0, result.confidence(), 1e-9);
  }

  @Test
  void inactiveFlameValueIsConfigurable() {
    FusionSettings lowActive = new FusionSettings(FusionSettings.defaultLimits(), 2, 5_000L, 5_000L, 2_000L, 0,
        256, 2);
    SensorFusionEngine inverted = new SensorFusionEngine(lowActive, new MeanExceedancePolicy(), clock, metrics);

    FusionResult idle = inverted.onRecord("RoomA", new SensorSample(0, 0, true, 0L)).orElseThrow();
    FusionResult burning = inverted.onRecord("RoomA", new SensorSample(0, 0, false, 0L)).orElseThrow();

    assertEquals(0, idle.sourcesTriggered());
    assertEquals(EnumSet.of(SensorChannel.FLAME), burning.contributing());
  }

  @Test
  void fieldSampleRaisesAlarmFromSmokeAndFlame() {
    FusionResult result = engine.onRecord("RoomA", new SensorSample(1734, 2293, true, 0L)).orElseThrow();

    assertTrue(result.alarm());
    assertEquals(EnumSet.of(SensorChannel.SMOKE, SensorChannel.FLAME), result.contributing());
    FusionSnapshot snapshot = engine.snapshot("RoomA").orElseThrow();
    assertTrue(snapshot.flame());
    assertEquals(1734 * 100.0 / 4095, snapshot.smokePercent(), 1e-9);
    assertTrue(Double.isNaN(snapshot.gasPpm()));
  }

  @Test
  void smokeAdcAloneIsOneSource() {
    FusionResult result = engine.onRecord("RoomA", new SensorSample(1100, 0, false, 0L)).orElseThrow();

    assertFalse(result.alarm());
    assertEquals(1, result.sourcesTriggered());
    assertEquals(EnumSet.of(SensorChannel.SMOKE), result.contributing());
  }

  @Test
  void gasFromSmokeAdcIsOptIn() {
    FusionSettings derived = new FusionSettings(FusionSettings.defaultLimits(), 2, 5_000L, 5_000L, 2_000L, 1,
        256, 2, true);
    SensorFusionEngine withGas = new SensorFusionEngine(derived, new MeanExceedancePolicy(), clock, metrics);

    FusionResult result = withGas.onRecord("RoomA", new SensorSample(1100, 0, false, 0L)).orElseThrow();

    assertEquals(EnumSet.of(SensorChannel.GAS, SensorChannel.SMOKE), result.contributing());
    assertTrue(withGas.snapshot("RoomA").orElseThrow().gasPpm() >= 400.0);
  }

  @Test
  void identityUpdatesSerialWithoutEvaluation() {
    assertTrue(engine.onRecord("RoomA", Identity.ofSerial("SIM001")).isEmpty());

    assertEquals("SIM001", engine.snapshot("RoomA").orElseThrow().serial());
    assertEquals(0L, metrics.counter(MetricNames.FUSION_INVOCATIONS, "RoomA"));
  }

  @Test
  void visionConfidenceExpires() {
    SensorFusionEngine noHold = new SensorFusionEngine(
        new FusionSettings(FusionSettings.defaultLimits(), 2, 0L, 5_000L, 2_000L, 1, 256, 2),
        new MeanExceedancePolicy(), clock, metrics);
    noHold.submitVision("RoomV", 0.9);

    FusionResult fresh = noHold.onRecord("RoomV", Packets.frameWithHotspot(24.0, 0, 60.0)).orElseThrow();
    assertTrue(fresh.alarm());
    assertTrue(fresh.contributing().contains(SensorChannel.VISION));

    clock.advance(2_001L);
    FusionResult stale = noHold.onRecord("RoomV", Packets.frameWithHotspot(24.0, 0, 60.0)).orElseThrow();
    assertFalse(stale.alarm());
    assertEquals(EnumSet.of(SensorChannel.TEMPERATURE), stale.contributing());
  }

  @Test
  void streamVisionResolvesThroughStreamMap() {
    SensorFusionEngine mapped = new SensorFusionEngine(FusionSettings.defaults(), new MeanExceedancePolicy(), clock,
        metrics, Map.of("cam-1", "RoomA"));

    assertTrue(mapped.submitStreamVision("cam-1", 0.95));
    assertFalse(mapped.submitStreamVision("cam-2", 0.95));
    FusionResult result = mapped.onRecord("RoomA", Packets.frameWithHotspot(24.0, 0, 60.0)).orElseThrow();
    assertTrue(result.alarm());
  }

  @Test
  void listenersReceiveEachRaisedAlarmOnce() {
    List<FusionResult> alarms = new ArrayList<>();
    engine.addAlarmListener(result -> {
      throw new IllegalStateException("listener failure");
    });
    engine.addAlarmListener(alarms::add);

    engine.fuse("RoomA", 80.0, 2_000.0, 0.0, 0.0, 0.0);
    clock.advance(100L);
    engine.fuse("RoomA", 80.0, 2_000.0, 0.0, 0.0, 0.0);

    assertEquals(1, alarms.size());
    assertEquals("RoomA", alarms.get(0).locationId());
  }

  @Test
  void policiesShapeConfidenceOnly() {
    Map<SensorChannel, Double> triggered = Map.of(SensorChannel.TEMPERATURE, 1.0, SensorChannel.GAS, 0.05);

    assertEquals(0.525, new MeanExceedancePolicy().score(triggered), 1e-9);
    assertEquals(1.0, new MaxExceedancePolicy().score(triggered), 1e-9);
    assertEquals(0.9, ConfidencePolicy.forName("weighted").score(triggered), 1e-9);
    assertEquals(1.0, ConfidencePolicy.forName("weighted").score(Map.of(
        SensorChannel.GAS, 0.1, SensorChannel.SMOKE, 0.1, SensorChannel.VISION, 0.1)), 1e-9);
    assertThrows(IllegalArgumentException.class, () -> ConfidencePolicy.forName("median"));
  }

  @Test
  void maxPolicyReportsStrongestChannel() {
    SensorFusionEngine maxEngine = new SensorFusionEngine(FusionSettings.defaults(), new MaxExceedancePolicy(),
        clock, metrics);

    FusionResult result = maxEngine.fuse("RoomA", 80.0, 400.0, 0.0, 0.0, 0.0);

    assertEquals(1.0, result.confidence(), 1e-9);
    assertEquals("max", maxEngine.policy().name());
  }
}
