package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.domain.fusion.SensorChannel;
import java.util.Map;

/**
 * Mean of the normalized exceedances of triggered channels. Default policy.
 */
public final class MeanExceedancePolicy implements ConfidencePolicy {

  @Override
  public double score(Map<SensorChannel, Double> triggered) {
    if (triggered.isEmpty()) {
      return 0d;
    }
    double sum = 0d;
    for (double value : triggered.values()) {
      sum += value;
    }
    return Math.min(1d, sum / triggered.size());
  }

  @Override
  public String name() {
    return "mean";
  }
}
