package ca.gc.cra.ember.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.infrastructure.metrics.MetricsCollector.MetricKey;
import ca.gc.cra.ember.support.ManualClock;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsCollectorTest {

  @Test
  void countersAreKeyedByNameAndLabel() {
    MetricsCollector collector = new MetricsCollector(new ManualClock(0L));

    collector.increment(MetricNames.PACKETS_RECEIVED, "RoomA");
    collector.add(MetricNames.PACKETS_RECEIVED, "RoomA", 4L);
    collector.increment(MetricNames.PACKETS_RECEIVED, "RoomB");
    collector.increment(MetricNames.PACKETS_ERRORS);

    assertEquals(5L, collector.counter(MetricNames.PACKETS_RECEIVED, "RoomA"));
    assertEquals(6L, collector.total(MetricNames.PACKETS_RECEIVED));
    assertEquals(1L, collector.counter(MetricNames.PACKETS_ERRORS, null));
    assertEquals(1L, collector.counter(MetricNames.PACKETS_ERRORS, " "));
    assertEquals(Long.valueOf(5L),
        collector.counterSnapshot().get(new MetricKey(MetricNames.PACKETS_RECEIVED, "RoomA")));
  }

  @Test
  void gaugesKeepLatestValue() {
    MetricsCollector collector = new MetricsCollector(new ManualClock(0L));

    collector.gauge(MetricNames.RATE_FPS, "cam-1", 25L);
    collector.gauge(MetricNames.RATE_FPS, "cam-1", 19L);
    collector.gauge(MetricNames.RATE_FPS, "cam-2", 30L);

    assertEquals(19L, collector.gaugeValue(MetricNames.RATE_FPS, "cam-1"));
    assertEquals(Map.of("cam-1", 19L, "cam-2", 30L), collector.gaugeSeries(MetricNames.RATE_FPS));
  }

  @Test
  void negativeCounterDeltaIsRejected() {
    MetricsCollector collector = new MetricsCollector();

    assertThrows(IllegalArgumentException.class, () -> collector.add(MetricNames.FUSION_ALARMS, "RoomA", -1L));
  }

  @Test
  void uptimeFollowsClock() {
    ManualClock clock = new ManualClock(10_000L);
    MetricsCollector collector = new MetricsCollector(clock);

    clock.advance(2_500L);

    assertEquals(2L, collector.uptimeSeconds());
  }
}
