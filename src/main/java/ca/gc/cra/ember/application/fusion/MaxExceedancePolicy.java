package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.domain.fusion.SensorChannel;
import java.util.Map;

/**
 * Largest normalized exceedance among triggered channels.
 */
public final class MaxExceedancePolicy implements ConfidencePolicy {

  @Override
  public double score(Map<SensorChannel, Double> triggered) {
    double max = 0d;
    for (double value : triggered.values()) {
      max = Math.max(max, value);
    }
    return Math.min(1d, max);
  }

  @Override
  public String name() {
    return "max";
  }
}
