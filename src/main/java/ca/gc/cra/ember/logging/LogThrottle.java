package ca.gc.cra.ember.logging;

import ca.gc.cra.ember.application.port.ClockPort;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-key log rate limiter. Retry cadence and log cadence are independent: a device retried every few seconds
 * logs its failure at most once per interval, with a count of what was suppressed in between.
 *
 * <p>Thread-safe.</p>
 */
public final class LogThrottle {
  private final ClockPort clock;
  private final long intervalMillis;
  private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

  /**
   * Creates a throttle.
   *
   * @param clock time source
   * @param intervalMillis minimum spacing between logged events per key; {@code 0} logs everything
   */
  public LogThrottle(ClockPort clock, long intervalMillis) {
    this.clock = Objects.requireNonNull(clock, "clock");
    if (intervalMillis < 0) {
      throw new IllegalArgumentException("intervalMillis must be >= 0");
    }
    this.intervalMillis = intervalMillis;
  }

  /**
   * Records an event for {@code key} and decides whether it should be logged.
   *
   * @param key throttle key, e.g. a device id
   * @return {@code -1} when the event must be suppressed, otherwise the number of events suppressed since the
   *     last logged one
   */
  public long tryAcquire(String key) {
    long now = clock.nowMillis();
    Window window = windows.computeIfAbsent(key, k -> new Window());
    synchronized (window) {
      if (window.lastLoggedMillis != Long.MIN_VALUE && now - window.lastLoggedMillis < intervalMillis) {
        window.suppressed++;
        return -1L;
      }
      long suppressed = window.suppressed;
      window.suppressed = 0L;
      window.lastLoggedMillis = now;
      return suppressed;
    }
  }

  /**
   * Forgets the state of a key, so the next event is logged immediately (e.g. after a recovery).
   *
   * @param key throttle key
   */
  public void reset(String key) {
    windows.remove(key);
  }

  private static final class Window {
    private long lastLoggedMillis = Long.MIN_VALUE;
    private long suppressed;
  }
}
