package ca.gc.cra.ember.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstraps the OpenTelemetry meter provider for EMBER.
 *
 * <p>The default exporter is a Prometheus pull endpoint; OTLP push and {@code none} are selected with
 * {@code otel.metrics.exporter} (system property) or {@code OTEL_METRICS_EXPORTER}.</p>
 */
public final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.ember";
  private static final String DEFAULT_EXPORTER = "prometheus";
  private static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";
  private static final String DEFAULT_PROMETHEUS_HOST = "0.0.0.0";
  private static final int DEFAULT_PROMETHEUS_PORT = 9464;
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Builds a meter provider from system properties and environment variables.
   *
   * @return active bootstrap, or a noop bootstrap when disabled or when initialization fails
   */
  public static BootstrapResult initialize() {
    try {
      BootstrapConfig config = BootstrapConfig.fromEnvironment();
      if (config.exporter() == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      return buildActive(config);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop exporter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    Objects.requireNonNull(reader, "reader");
    String version = detectServiceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(version))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static BootstrapResult buildActive(BootstrapConfig config) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource(config.instrumentationVersion()))
        .registerMetricReader(createReader(config))
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(config.instrumentationVersion())
        .build();
    log.info("OpenTelemetry metrics initialized with exporter {} at {}", config.exporter(), config.target());
    return BootstrapResult.active(provider, meter);
  }

  private static MetricReader createReader(BootstrapConfig config) {
    if (config.exporter() == ExporterMode.OTLP) {
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(config.otlpEndpoint()).build();
      return PeriodicMetricReader.builder(exporter).setInterval(Duration.ofSeconds(30)).build();
    }
    return PrometheusHttpServer.builder()
        .setHost(config.prometheusHost())
        .setPort(config.prometheusPort())
        .build();
  }

  private static Resource buildResource(String version) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "ember")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    String instanceId = detectInstanceId();
    if (!instanceId.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instanceId);
    }
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static String detectInstanceId() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Falling back to runtime MXBean for instance id", ex);
      String runtimeName = ManagementFactory.getRuntimeMXBean().getName();
      return runtimeName != null ? runtimeName : "unknown";
    }
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    return "0.0.0-dev";
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  record BootstrapConfig(
      ExporterMode exporter,
      String otlpEndpoint,
      String prometheusHost,
      int prometheusPort,
      String instrumentationVersion) {

    static BootstrapConfig fromEnvironment() {
      Properties props = System.getProperties();
      ExporterMode exporter = ExporterMode.from(firstNonBlank(
          props.getProperty("otel.metrics.exporter"),
          System.getenv("OTEL_METRICS_EXPORTER"),
          DEFAULT_EXPORTER));
      String endpoint = firstNonBlank(
          props.getProperty("otel.exporter.otlp.endpoint"),
          System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
          DEFAULT_OTLP_ENDPOINT);
      String host = firstNonBlank(
          props.getProperty("otel.exporter.prometheus.host"),
          System.getenv("OTEL_EXPORTER_PROMETHEUS_HOST"),
          DEFAULT_PROMETHEUS_HOST);
      String portRaw = firstNonBlank(
          props.getProperty("otel.exporter.prometheus.port"),
          System.getenv("OTEL_EXPORTER_PROMETHEUS_PORT"),
          Integer.toString(DEFAULT_PROMETHEUS_PORT));
      int port;
      try {
        port = Integer.parseInt(portRaw);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("prometheus port must be numeric (was " + portRaw + ")", ex);
      }
      return new BootstrapConfig(exporter, endpoint, host, port, detectServiceVersion());
    }

    String target() {
      return exporter == ExporterMode.OTLP ? otlpEndpoint : prometheusHost + ":" + prometheusPort;
    }
  }

  enum ExporterMode {
    PROMETHEUS,
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return PROMETHEUS;
      }
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        case "prometheus" -> PROMETHEUS;
        default -> {
          log.warn("Unknown metrics exporter '{}'; defaulting to {}", raw, DEFAULT_EXPORTER);
          yield PROMETHEUS;
        }
      };
    }
  }

  /**
   * Meter provider handle. Closing it stops exporters, including the Prometheus HTTP listener.
   */
  public static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;
    private final boolean noop;

    private BootstrapResult(Meter meter, SdkMeterProvider provider, boolean noop) {
      this.meter = meter;
      this.provider = provider;
      this.noop = noop;
    }

    static BootstrapResult noop() {
      MeterProvider provider = MeterProvider.noop();
      return new BootstrapResult(provider.get(INSTRUMENTATION_SCOPE), null, true);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider, false);
    }

    Meter meter() {
      return meter;
    }

    public boolean isNoop() {
      return noop;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
