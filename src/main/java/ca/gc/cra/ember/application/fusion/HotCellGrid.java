package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.domain.record.ThermalFrame;
import java.util.Arrays;

/**
 * Debounced view of a thermal grid. A cell that reaches the threshold at time T stays hot until
 * {@code T + decay}; re-triggering only ever pushes the deadline later.
 *
 * <p>Not thread-safe; owned by one {@link FusionState}.</p>
 */
final class HotCellGrid {
  private static final long NEVER = Long.MIN_VALUE;

  private final long decayMillis;
  private final long[] deadlines = new long[ThermalFrame.CELLS];
  private final double[] peakCelsius = new double[ThermalFrame.CELLS];

  HotCellGrid(long decayMillis) {
    if (decayMillis < 0) {
      throw new IllegalArgumentException("decayMillis must be >= 0");
    }
    this.decayMillis = decayMillis;
    Arrays.fill(deadlines, NEVER);
  }

  /**
   * Applies one frame.
   *
   * @param frame calibrated frame
   * @param thresholdCelsius trigger temperature (inclusive)
   * @param nowMillis frame time
   * @return number of cells at or above threshold in this frame
   */
  int update(ThermalFrame frame, double thresholdCelsius, long nowMillis) {
    int exceeded = 0;
    for (int i = 0; i < ThermalFrame.CELLS; i++) {
      double value = frame.celsius(i);
      if (value >= thresholdCelsius) {
        exceeded++;
        long candidate = nowMillis + decayMillis;
        if (deadlines[i] == NEVER || candidate >= deadlines[i]) {
          deadlines[i] = candidate;
          peakCelsius[i] = value;
        }
      }
    }
    return exceeded;
  }

  boolean isHot(int index, long nowMillis) {
    long deadline = deadlines[index];
    return deadline != NEVER && nowMillis <= deadline;
  }

  long deadline(int index) {
    return deadlines[index];
  }

  int hotCount(long nowMillis) {
    int count = 0;
    for (int i = 0; i < ThermalFrame.CELLS; i++) {
      if (isHot(i, nowMillis)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Highest temperature recorded by a currently hot cell at its last exceedance.
   *
   * @param nowMillis evaluation time
   * @return temperature, or {@link Double#NaN} when no cell is hot
   */
  double hottest(long nowMillis) {
    double max = Double.NaN;
    for (int i = 0; i < ThermalFrame.CELLS; i++) {
      if (isHot(i, nowMillis) && (Double.isNaN(max) || peakCelsius[i] > max)) {
        max = peakCelsius[i];
      }
    }
    return max;
  }
}
