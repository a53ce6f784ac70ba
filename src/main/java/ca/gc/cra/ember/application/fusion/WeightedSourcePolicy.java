package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.domain.fusion.SensorChannel;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sum of fixed per-channel weights of triggered channels, capped at 1. Exceedance magnitude is ignored.
 */
public final class WeightedSourcePolicy implements ConfidencePolicy {
  private final Map<SensorChannel, Double> weights;

  public WeightedSourcePolicy(Map<SensorChannel, Double> weights) {
    Objects.requireNonNull(weights, "weights");
    EnumMap<SensorChannel, Double> copy = new EnumMap<>(SensorChannel.class);
    for (SensorChannel channel : SensorChannel.values()) {
      Double weight = weights.get(channel);
      if (weight == null || weight < 0d || weight.isNaN()) {
        throw new IllegalArgumentException("weight for " + channel + " must be a non-negative number");
      }
      copy.put(channel, weight);
    }
    this.weights = copy;
  }

  static WeightedSourcePolicy defaults() {
    EnumMap<SensorChannel, Double> weights = new EnumMap<>(SensorChannel.class);
    weights.put(SensorChannel.TEMPERATURE, 0.4d);
    weights.put(SensorChannel.GAS, 0.5d);
    weights.put(SensorChannel.SMOKE, 0.5d);
    weights.put(SensorChannel.FLAME, 0.3d);
    weights.put(SensorChannel.VISION, 0.4d);
    return new WeightedSourcePolicy(weights);
  }

  @Override
  public double score(Map<SensorChannel, Double> triggered) {
    double sum = 0d;
    for (SensorChannel channel : triggered.keySet()) {
      sum += weights.get(channel);
    }
    return Math.min(1d, sum);
  }

  @Override
  public String name() {
    return "weighted";
  }
}
