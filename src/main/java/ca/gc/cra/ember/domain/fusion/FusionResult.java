package ca.gc.cra.ember.domain.fusion;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Alarm decision for one location.
 *
 * @param locationId evaluated location
 * @param alarm {@code true} when enough channels exceeded their thresholds
 * @param confidence aggregate confidence in [0, 1]
 * @param sourcesTriggered number of channels at or above threshold
 * @param contributing channels that triggered
 * @param held {@code true} when the decision was latched from an earlier alarm during the hold period
 * @param evaluatedAtMillis evaluation time in epoch millis
 */
public record FusionResult(
    String locationId,
    boolean alarm,
    double confidence,
    int sourcesTriggered,
    Set<SensorChannel> contributing,
    boolean held,
    long evaluatedAtMillis) {

  public FusionResult {
    Objects.requireNonNull(locationId, "locationId");
    if (Double.isNaN(confidence) || confidence < 0d || confidence > 1d) {
      throw new IllegalArgumentException("confidence must be within [0,1] (was " + confidence + ")");
    }
    contributing = contributing == null || contributing.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(contributing));
    if (sourcesTriggered != contributing.size()) {
      throw new IllegalArgumentException("sourcesTriggered must match contributing channel count");
    }
  }

  /**
   * Returns the same decision marked as latched at a later time.
   *
   * @param atMillis time of the frozen evaluation
   * @return held copy
   */
  public FusionResult asHeld(long atMillis) {
    return new FusionResult(locationId, alarm, confidence, sourcesTriggered, contributing, true, atMillis);
  }
}
