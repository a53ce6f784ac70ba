package ca.gc.cra.ember.application.rate;

import ca.gc.cra.ember.application.port.ClockPort;
import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.application.port.MetricsPort;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the backlog depth of a capture stream to a recommended frame rate.
 *
 * <ul>
 *   <li>{@code depth >= highWatermark}: {@code fps = max(minFps, floor(fps * 0.75))}</li>
 *   <li>{@code depth < lowWatermark}: {@code fps = min(maxFps, fps + 1)}</li>
 *   <li>otherwise the rate is held</li>
 * </ul>
 *
 * <p>A stream is adjusted at most once per cooldown window; the first adjustment is immediate. The controller
 * performs no I/O and is deterministic for a given depth sequence and clock. Thread-safe; streams are
 * independent.</p>
 */
public final class AdaptiveRateController {
  private static final Logger log = LoggerFactory.getLogger(AdaptiveRateController.class);
  static final double REDUCTION_FACTOR = 0.75d;

  private final RateSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ConcurrentMap<String, StreamRate> streams = new ConcurrentHashMap<>();

  public AdaptiveRateController(RateSettings settings, ClockPort clock, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Feeds one backlog observation.
   *
   * @param streamId stream identifier
   * @param queueDepth pending work items for the stream; negative values are rejected
   * @return the frame rate to use from now on
   */
  public int update(String streamId, int queueDepth) {
    Objects.requireNonNull(streamId, "streamId");
    if (queueDepth < 0) {
      throw new IllegalArgumentException("queueDepth must be >= 0 (was " + queueDepth + ")");
    }
    StreamRate stream = streams.computeIfAbsent(streamId, id -> new StreamRate(settings.baseFps()));
    synchronized (stream) {
      long now = clock.nowMillis();
      if (stream.adjusted && now - stream.lastAdjustmentMillis < settings.cooldownMillis()) {
        return stream.fps;
      }
      int next = stream.fps;
      if (queueDepth >= settings.highWatermark()) {
        next = Math.max(settings.minFps(), (int) Math.floor(stream.fps * REDUCTION_FACTOR));
      } else if (queueDepth < settings.lowWatermark()) {
        next = Math.min(settings.maxFps(), stream.fps + 1);
      }
      if (next != stream.fps) {
        log.debug("Stream {} rate {} -> {} fps (depth={})", streamId, stream.fps, next, queueDepth);
        stream.fps = next;
        stream.adjusted = true;
        stream.lastAdjustmentMillis = now;
      }
      metrics.gauge(MetricNames.RATE_FPS, streamId, stream.fps);
      return stream.fps;
    }
  }

  public int currentFps(String streamId) {
    StreamRate stream = streams.get(streamId);
    if (stream == null) {
      return settings.baseFps();
    }
    synchronized (stream) {
      return stream.fps;
    }
  }

  /**
   * Frame interval matching the current rate.
   *
   * @param streamId stream identifier
   * @return {@code floor(1000 / fps)} milliseconds
   */
  public long frameIntervalMillis(String streamId) {
    return 1_000L / currentFps(streamId);
  }

  /**
   * Puts a stream back to the base rate and clears its cooldown.
   *
   * @param streamId stream identifier
   */
  public void reset(String streamId) {
    streams.remove(streamId);
    metrics.gauge(MetricNames.RATE_FPS, streamId, settings.baseFps());
  }

  /**
   * Current rate of every stream seen so far.
   *
   * @return stream id to fps, sorted by stream id
   */
  public Map<String, Integer> rates() {
    Map<String, Integer> out = new TreeMap<>();
    streams.keySet().forEach(id -> out.put(id, currentFps(id)));
    return out;
  }

  public RateSettings settings() {
    return settings;
  }

  private static final class StreamRate {
    private int fps;
    private boolean adjusted;
    private long lastAdjustmentMillis;

    private StreamRate(int fps) {
      this.fps = fps;
    }
  }
}
