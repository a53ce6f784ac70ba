package ca.gc.cra.ember.config;

import ca.gc.cra.ember.validation.Net;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Metrics exporter selection.
 *
 * @param exporter {@code prometheus}, {@code otlp}, or {@code none}
 * @param host Prometheus listen host
 * @param port Prometheus listen port
 * @param otlpEndpoint OTLP collector endpoint; blank unless {@code exporter=otlp}
 */
public record MetricsSettings(String exporter, String host, int port, String otlpEndpoint) {
  public static final int DEFAULT_PORT = 9464;

  public MetricsSettings {
    exporter = exporter == null || exporter.isBlank() ? "prometheus" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("prometheus") && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metrics.exporter must be prometheus, otlp or none (was " + exporter + ")");
    }
    host = Net.requireHost("metrics.host", host);
    Net.requirePort("metrics.port", port, false);
    otlpEndpoint = otlpEndpoint == null ? "" : otlpEndpoint.trim();
    if (!otlpEndpoint.isEmpty()) {
      validateEndpoint(otlpEndpoint);
    }
  }

  public static MetricsSettings defaults() {
    return new MetricsSettings("prometheus", "0.0.0.0", DEFAULT_PORT, "");
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("metrics.otlpEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("metrics.otlpEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("metrics.otlpEndpoint must be a valid URI", ex);
    }
  }
}
