package ca.gc.cra.ember.application.rate;

import ca.gc.cra.ember.validation.Numbers;

/**
 * Adaptive rate parameters.
 *
 * @param baseFps starting rate of every stream
 * @param minFps lower bound under backlog
 * @param maxFps upper bound when the backlog is drained
 * @param highWatermark backlog depth at or above which the rate is cut by a quarter
 * @param lowWatermark backlog depth below which the rate grows by one frame per second
 * @param cooldownMillis minimum spacing between two adjustments of one stream
 */
public record RateSettings(
    int baseFps, int minFps, int maxFps, int highWatermark, int lowWatermark, long cooldownMillis) {

  public RateSettings {
    Numbers.requireRange("rate.minFps", minFps, 1, 240);
    Numbers.requireRange("rate.maxFps", maxFps, minFps, 240);
    Numbers.requireRange("rate.baseFps", baseFps, minFps, maxFps);
    Numbers.requireRange("rate.lowWatermark", lowWatermark, 0, 1_000_000);
    Numbers.requireRange("rate.highWatermark", highWatermark, lowWatermark + 1L, 1_000_000);
    Numbers.requireRange("rate.cooldownMillis", cooldownMillis, 0, 60_000);
  }

  public static RateSettings defaults() {
    return new RateSettings(25, 5, 30, 8, 2, 1_000L);
  }
}
