package ca.gc.cra.ember.application.port;

import java.util.Map;

/**
 * Catalogue of metric names and the label key each one carries.
 */
public final class MetricNames {
  public static final String LABEL_LOCATION = "location_id";
  public static final String LABEL_STREAM = "stream_id";
  public static final String LABEL_DEVICE = "device_id";

  public static final String PACKETS_RECEIVED = "ember.ingest.packets.received";
  public static final String PACKETS_ERRORS = "ember.ingest.packets.errors";
  public static final String FRAMES_THERMAL = "ember.ingest.frames.thermal";
  public static final String SAMPLES_SENSOR = "ember.ingest.samples.sensor";
  public static final String HANDOFF_DROPPED = "ember.ingest.handoff.dropped";
  public static final String HANDOFF_DEPTH = "ember.ingest.handoff.depth";
  public static final String CONNECTIONS_ACTIVE = "ember.ingest.connections.active";
  public static final String CONNECTIONS_REJECTED = "ember.ingest.connections.rejected";
  public static final String FUSION_INVOCATIONS = "ember.fusion.invocations";
  public static final String FUSION_ALARMS = "ember.fusion.alarms";
  public static final String RATE_FPS = "ember.rate.fps";
  public static final String DISPATCH_SUCCESS = "ember.scheduler.dispatch.success";
  public static final String DISPATCH_FAILURE = "ember.scheduler.dispatch.failure";
  public static final String UPTIME_SECONDS = "ember.uptime.seconds";

  private static final Map<String, String> LABEL_KEYS = Map.ofEntries(
      Map.entry(PACKETS_RECEIVED, LABEL_LOCATION),
      Map.entry(PACKETS_ERRORS, LABEL_LOCATION),
      Map.entry(FRAMES_THERMAL, LABEL_LOCATION),
      Map.entry(SAMPLES_SENSOR, LABEL_LOCATION),
      Map.entry(HANDOFF_DROPPED, LABEL_LOCATION),
      Map.entry(HANDOFF_DEPTH, LABEL_LOCATION),
      Map.entry(FUSION_INVOCATIONS, LABEL_LOCATION),
      Map.entry(FUSION_ALARMS, LABEL_LOCATION),
      Map.entry(RATE_FPS, LABEL_STREAM),
      Map.entry(DISPATCH_SUCCESS, LABEL_DEVICE),
      Map.entry(DISPATCH_FAILURE, LABEL_DEVICE));

  private MetricNames() {}

  /**
   * Returns the label key for a metric, or {@code "label"} for names outside the catalogue.
   *
   * @param metric metric name
   * @return label key used when exporting labelled values
   */
  public static String labelKey(String metric) {
    return LABEL_KEYS.getOrDefault(metric, "label");
  }
}
