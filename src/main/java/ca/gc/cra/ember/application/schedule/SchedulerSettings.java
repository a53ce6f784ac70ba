package ca.gc.cra.ember.application.schedule;

import ca.gc.cra.ember.validation.Numbers;

/**
 * Device scheduler parameters.
 *
 * @param tickMillis evaluation resolution
 * @param periodOnRetrySeconds spacing between {@code PERIOD_ON} attempts while it keeps failing
 * @param eepromRefreshSeconds {@code EEPROM1} refresh cadence; {@code 0} disables it
 * @param failureLogIntervalSeconds minimum spacing of dispatch-failure log lines per device
 * @param dispatchThreads concurrent dispatches across devices
 * @param connectTimeoutMillis device connect timeout
 * @param ackTimeoutMillis acknowledgement read timeout
 */
public record SchedulerSettings(
    long tickMillis,
    int periodOnRetrySeconds,
    int eepromRefreshSeconds,
    int failureLogIntervalSeconds,
    int dispatchThreads,
    int connectTimeoutMillis,
    int ackTimeoutMillis) {

  public SchedulerSettings {
    Numbers.requireRange("scheduler.tickMillis", tickMillis, 10, 60_000);
    Numbers.requireRange("scheduler.periodOnRetrySeconds", periodOnRetrySeconds, 1, 3_600);
    Numbers.requireRange("scheduler.eepromRefreshSeconds", eepromRefreshSeconds, 0, 86_400);
    Numbers.requireRange("scheduler.failureLogIntervalSeconds", failureLogIntervalSeconds, 0, 86_400);
    Numbers.requireRange("scheduler.dispatchThreads", dispatchThreads, 1, 256);
    Numbers.requireRange("scheduler.connectTimeoutMillis", connectTimeoutMillis, 1, 60_000);
    Numbers.requireRange("scheduler.ackTimeoutMillis", ackTimeoutMillis, 1, 60_000);
  }

  public static SchedulerSettings defaults() {
    return new SchedulerSettings(1_000L, 30, 0, 60, 8, 2_000, 3_000);
  }

  public long periodOnRetryMillis() {
    return periodOnRetrySeconds * 1_000L;
  }

  public long eepromRefreshMillis() {
    return eepromRefreshSeconds * 1_000L;
  }
}
