package ca.gc.cra.ember.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.support.ManualClock;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(
        new MetricsCollector(new ManualClock(0L)), OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void countersCarryCataloguedLabelKey() {
    adapter.increment(MetricNames.FUSION_ALARMS, "RoomA");
    adapter.add(MetricNames.FUSION_ALARMS, "RoomA", 2L);
    adapter.increment(MetricNames.DISPATCH_FAILURE, "pfds-1");

    Collection<MetricData> metrics = reader.collectAllMetrics();

    LongPointData alarms = point(metrics, MetricNames.FUSION_ALARMS, false).orElseThrow();
    assertEquals(3L, alarms.getValue());
    assertEquals("RoomA", alarms.getAttributes().get(AttributeKey.stringKey(MetricNames.LABEL_LOCATION)));
    LongPointData failures = point(metrics, MetricNames.DISPATCH_FAILURE, false).orElseThrow();
    assertEquals("pfds-1", failures.getAttributes().get(AttributeKey.stringKey(MetricNames.LABEL_DEVICE)));
    assertEquals(3L, adapter.collector().counter(MetricNames.FUSION_ALARMS, "RoomA"));
  }

  @Test
  void gaugesReportLatestValueAtCollection() {
    adapter.gauge(MetricNames.RATE_FPS, "cam-1", 25L);
    adapter.gauge(MetricNames.RATE_FPS, "cam-1", 19L);

    LongPointData fps = point(reader.collectAllMetrics(), MetricNames.RATE_FPS, true).orElseThrow();

    assertEquals(19L, fps.getValue());
    assertEquals("cam-1", fps.getAttributes().get(AttributeKey.stringKey(MetricNames.LABEL_STREAM)));
  }

  @Test
  void uptimeGaugeIsAlwaysExported() {
    assertTrue(point(reader.collectAllMetrics(), MetricNames.UPTIME_SECONDS, true).isPresent());
  }

  @Test
  void noopBootstrapStillRecordsInProcess() {
    MetricsCollector collector = new MetricsCollector();
    OpenTelemetryMetricsAdapter noop =
        new OpenTelemetryMetricsAdapter(collector, OpenTelemetryBootstrap.BootstrapResult.noop());

    noop.increment(MetricNames.PACKETS_RECEIVED, "RoomA");
    noop.close();

    assertEquals(1L, collector.counter(MetricNames.PACKETS_RECEIVED, "RoomA"));
    assertFalse(point(reader.collectAllMetrics(), MetricNames.PACKETS_RECEIVED, false).isPresent());
  }

  private static Optional<LongPointData> point(Collection<MetricData> metrics, String name, boolean gauge) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .flatMap(metric -> gauge
            ? metric.getLongGaugeData().getPoints().stream()
            : metric.getLongSumData().getPoints().stream())
        .findFirst();
  }
}
