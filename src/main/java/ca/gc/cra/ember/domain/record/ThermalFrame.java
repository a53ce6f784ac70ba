package ca.gc.cra.ember.domain.record;

import java.util.Arrays;

/**
 * One 32x24 thermal image. Keeps the raw wire words next to the calibrated temperatures so a frame can be
 * re-encoded without precision loss.
 *
 * <p>Cells are stored row-major: index {@code row * COLS + col}.</p>
 */
public final class ThermalFrame implements DecodedRecord {
  public static final int ROWS = 24;
  public static final int COLS = 32;
  public static final int CELLS = ROWS * COLS;

  private final int[] raw;
  private final double[] celsius;

  /**
   * Creates a frame from raw words and the calibration that produced the temperatures.
   *
   * @param raw 768 unsigned 16-bit words; copied
   * @param calibration conversion applied to each word
   * @throws IllegalArgumentException if the word count is not {@value #CELLS} or a word exceeds 16 bits
   */
  public ThermalFrame(int[] raw, ThermalCalibration calibration) {
    if (raw == null || raw.length != CELLS) {
      throw new IllegalArgumentException(
          "thermal frame requires " + CELLS + " cells (was " + (raw == null ? 0 : raw.length) + ")");
    }
    this.raw = raw.clone();
    this.celsius = new double[CELLS];
    for (int i = 0; i < CELLS; i++) {
      int word = this.raw[i];
      if (word < 0 || word > 0xFFFF) {
        throw new IllegalArgumentException("thermal word out of 16-bit range at cell " + i);
      }
      celsius[i] = calibration.apply(word);
    }
  }

  public int rawWord(int index) {
    return raw[index];
  }

  public int[] rawWords() {
    return raw.clone();
  }

  public double celsius(int index) {
    return celsius[index];
  }

  public double celsius(int row, int col) {
    if (row < 0 || row >= ROWS || col < 0 || col >= COLS) {
      throw new IndexOutOfBoundsException("cell (" + row + "," + col + ") outside 24x32 grid");
    }
    return celsius[row * COLS + col];
  }

  public double[] temperatures() {
    return celsius.clone();
  }

  public double maxCelsius() {
    double max = Double.NEGATIVE_INFINITY;
    for (double value : celsius) {
      max = Math.max(max, value);
    }
    return max;
  }

  @Override
  public String kind() {
    return "thermal";
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof ThermalFrame frame
        && Arrays.equals(raw, frame.raw)
        && Arrays.equals(celsius, frame.celsius);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(raw);
  }

  @Override
  public String toString() {
    return "ThermalFrame[cells=" + CELLS + ", max=" + String.format("%.2f", maxCelsius()) + "]";
  }
}
