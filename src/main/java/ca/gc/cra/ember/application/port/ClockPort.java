package ca.gc.cra.ember.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to fusion, rate control, and scheduling.
 * <p><strong>Why:</strong> Hot-cell decay, hold periods, cooldowns, and poll cadences are all time based;
 * tests drive them with a manual clock.
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.ember.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
