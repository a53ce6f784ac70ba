package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.validation.Numbers;

/**
 * Threshold and saturation point of one fusion channel. A reading at or above {@code threshold} triggers the
 * channel; {@code saturation} is the reading that counts as full exceedance.
 *
 * @param threshold trigger level (inclusive)
 * @param saturation level mapped to normalized exceedance 1.0; must be greater than {@code threshold}
 */
public record ChannelLimit(double threshold, double saturation) {
  public ChannelLimit {
    Numbers.requireRange("threshold", threshold, -1_000_000d, 1_000_000d);
    Numbers.requireRange("saturation", saturation, -1_000_000d, 1_000_000d);
    if (saturation <= threshold) {
      throw new IllegalArgumentException(
          "saturation must be greater than threshold (threshold=" + threshold + ", saturation=" + saturation + ")");
    }
  }

  public boolean triggers(double value) {
    return value >= threshold;
  }

  /**
   * Normalized exceedance {@code clamp((value - threshold) / (saturation - threshold), 0, 1)}.
   *
   * @param value reading
   * @return exceedance in [0, 1]
   */
  public double exceedance(double value) {
    double ratio = (value - threshold) / (saturation - threshold);
    return Math.max(0d, Math.min(1d, ratio));
  }
}
