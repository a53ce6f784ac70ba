package ca.gc.cra.ember.api;

import ca.gc.cra.ember.config.MetricsSettings;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes the validated metrics settings as the {@code otel.*} system properties read by the OpenTelemetry
 * bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  static void configureMetrics(MetricsSettings settings) {
    if (settings == null) {
      return;
    }
    String exporter = settings.exporter().toLowerCase(Locale.ROOT);
    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    System.setProperty("otel.metrics.exporter", exporter);
    switch (exporter) {
      case "otlp" -> {
        log.debug("Configuring OTLP endpoint: {}", settings.otlpEndpoint());
        System.setProperty("otel.exporter.otlp.endpoint", settings.otlpEndpoint());
      }
      case "prometheus" -> {
        System.setProperty("otel.exporter.prometheus.host", settings.host());
        System.setProperty("otel.exporter.prometheus.port", Integer.toString(settings.port()));
      }
      default -> log.debug("Metrics export disabled");
    }
  }
}
