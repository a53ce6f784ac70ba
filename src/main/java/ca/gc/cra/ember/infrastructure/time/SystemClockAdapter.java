package ca.gc.cra.ember.infrastructure.time;

import ca.gc.cra.ember.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote No smoothing; wall clock adjustments are visible to callers.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
