package ca.gc.cra.ember.application.port;

/**
 * <strong>What:</strong> Port for recording EMBER counters and gauges.
 * <p><strong>Why:</strong> Ingestion, fusion, rate control, and scheduling report through one seam so the
 * exposition backend can change without touching the pipeline.
 * <p><strong>Role:</strong> Application port implemented by metrics adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Increment labelled counters (packets per location, dispatches per device).</li>
 *   <li>Set labelled gauges (queue depth per location, fps per stream).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every connection handler, fusion
 * worker, and dispatch thread writes concurrently.</p>
 * <p><strong>Performance:</strong> Expected O(1) and non-blocking.</p>
 * <p><strong>Observability:</strong> Metric names and label keys are catalogued in {@link MetricNames}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Adds one to a labelled counter.
   *
   * @param key metric name from {@link MetricNames}; must not be {@code null}
   * @param label label value (location, stream, or device id); {@code null} or blank means unlabelled
   */
  default void increment(String key, String label) {
    add(key, label, 1L);
  }

  /**
   * Adds one to an unlabelled counter.
   *
   * @param key metric name; must not be {@code null}
   */
  default void increment(String key) {
    add(key, null, 1L);
  }

  /**
   * Adds a non-negative delta to a labelled counter.
   *
   * @param key metric name; must not be {@code null}
   * @param label label value or {@code null}
   * @param delta amount to add; negative values are rejected
   */
  void add(String key, String label, long delta);

  /**
   * Sets the current value of a labelled gauge.
   *
   * @param key metric name; must not be {@code null}
   * @param label label value or {@code null}
   * @param value current value
   */
  void gauge(String key, String label, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void add(String key, String label, long delta) {}

    @Override public void gauge(String key, String label, long value) {}
  };
}
