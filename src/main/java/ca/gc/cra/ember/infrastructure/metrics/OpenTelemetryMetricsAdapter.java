package ca.gc.cra.ember.infrastructure.metrics;

import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableLongGauge;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that records into a {@link MetricsCollector} and mirrors every update into OpenTelemetry.
 *
 * <p>Counters map to OpenTelemetry counters with the catalogued label as an attribute. Gauges are exported
 * through asynchronous callbacks that read the collector at collection time, so the exported value is always
 * the latest one.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);

  private final MetricsCollector collector;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final MetricsDelegate delegate;

  /**
   * Creates an adapter wired to the environment-configured exporter.
   *
   * @param collector backing store
   */
  public OpenTelemetryMetricsAdapter(MetricsCollector collector) {
    this(collector, OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(MetricsCollector collector, OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.collector = Objects.requireNonNull(collector, "collector");
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode; values remain available in-process");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter(), collector);
    }
  }

  @Override
  public void add(String key, String label, long delta) {
    collector.add(key, label, delta);
    delegate.add(key, label, delta);
  }

  @Override
  public void gauge(String key, String label, long value) {
    collector.gauge(key, label, value);
    delegate.gauge(key);
  }

  public MetricsCollector collector() {
    return collector;
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    delegate.close();
    bootstrap.close();
  }

  private interface MetricsDelegate {
    void add(String key, String label, long delta);

    void gauge(String key);

    void close();
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void add(String key, String label, long delta) {
      // no-op
    }

    @Override
    public void gauge(String key) {
      // no-op
    }

    @Override
    public void close() {
      // no-op
    }
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final Meter meter;
    private final MetricsCollector collector;
    private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ObservableLongGauge> gauges = new ConcurrentHashMap<>();
    private final List<AutoCloseable> callbacks = new CopyOnWriteArrayList<>();

    private OtelDelegate(Meter meter, MetricsCollector collector) {
      this.meter = Objects.requireNonNull(meter, "meter");
      this.collector = collector;
      callbacks.add(meter.gaugeBuilder(MetricNames.UPTIME_SECONDS)
          .ofLongs()
          .setUnit("s")
          .setDescription("Seconds since the process started")
          .buildWithCallback(measurement -> measurement.record(collector.uptimeSeconds())));
    }

    @Override
    public void add(String key, String label, long delta) {
      LongCounter counter = counters.computeIfAbsent(key, this::createCounter);
      counter.add(delta, attributes(key, label));
    }

    @Override
    public void gauge(String key) {
      gauges.computeIfAbsent(key, this::createGauge);
    }

    @Override
    public void close() {
      for (AutoCloseable callback : callbacks) {
        try {
          callback.close();
        } catch (Exception ex) {
          log.debug("Failed to unregister gauge callback", ex);
        }
      }
    }

    private LongCounter createCounter(String key) {
      return meter.counterBuilder(key)
          .setUnit("1")
          .setDescription("EMBER counter " + key)
          .build();
    }

    private ObservableLongGauge createGauge(String key) {
      ObservableLongGauge gauge = meter.gaugeBuilder(key)
          .ofLongs()
          .setDescription("EMBER gauge " + key)
          .buildWithCallback(measurement -> {
            for (Map.Entry<String, Long> entry : collector.gaugeSeries(key).entrySet()) {
              measurement.record(entry.getValue(), attributes(key, entry.getKey()));
            }
          });
      callbacks.add(gauge);
      return gauge;
    }

    private static Attributes attributes(String key, String label) {
      if (label == null || label.isBlank()) {
        return Attributes.empty();
      }
      return Attributes.of(AttributeKey.stringKey(MetricNames.labelKey(key)), label);
    }
  }
}
