package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.domain.fusion.SensorChannel;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregates the normalized exceedances of triggered channels into one confidence value.
 *
 * <p>The alarm decision itself is always {@code sourcesTriggered >= minSources}; a policy only shapes the
 * reported confidence.</p>
 */
public interface ConfidencePolicy {

  /**
   * Scores the triggered channels.
   *
   * @param triggered normalized exceedance in [0, 1] per triggered channel; empty when nothing triggered
   * @return confidence in [0, 1]
   */
  double score(Map<SensorChannel, Double> triggered);

  /**
   * Policy name used in configuration.
   *
   * @return lowercase name
   */
  String name();

  /**
   * Resolves a policy by configuration name.
   *
   * @param name {@code mean}, {@code max}, or {@code weighted}
   * @return policy instance
   * @throws IllegalArgumentException for unknown names
   */
  static ConfidencePolicy forName(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "", "mean" -> new MeanExceedancePolicy();
      case "max" -> new MaxExceedancePolicy();
      case "weighted" -> WeightedSourcePolicy.defaults();
      default -> throw new IllegalArgumentException(
          "fusion.confidencePolicy must be mean, max or weighted (was " + name + ")");
    };
  }
}
