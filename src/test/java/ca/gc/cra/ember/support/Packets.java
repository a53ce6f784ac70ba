package ca.gc.cra.ember.support;

import ca.gc.cra.ember.domain.record.ThermalCalibration;
import ca.gc.cra.ember.domain.record.ThermalFrame;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** Packet and frame builders shared by protocol, fusion, and ingestion tests. */
public final class Packets {
  private Packets() {}

  /**
   * Raw words for a frame at a uniform temperature under the default calibration.
   *
   * @param celsius temperature of every cell
   * @return 768 raw words
   */
  public static int[] uniformWords(double celsius) {
    int[] words = new int[ThermalFrame.CELLS];
    Arrays.fill(words, toWord(celsius));
    return words;
  }

  public static int toWord(double celsius) {
    return (int) Math.round((celsius - ThermalCalibration.DEFAULT_OFFSET) / ThermalCalibration.DEFAULT_SCALE)
        & 0xFFFF;
  }

  public static ThermalFrame uniformFrame(double celsius) {
    return new ThermalFrame(uniformWords(celsius), ThermalCalibration.defaults());
  }

  /**
   * Frame at {@code background} with one cell at {@code hot}.
   *
   * @param background background temperature
   * @param hotIndex index of the hot cell
   * @param hot hot cell temperature
   * @return frame
   */
  public static ThermalFrame frameWithHotspot(double background, int hotIndex, double hot) {
    int[] words = uniformWords(background);
    words[hotIndex] = toWord(hot);
    return new ThermalFrame(words, ThermalCalibration.defaults());
  }

  public static byte[] ascii(String text) {
    return text.getBytes(StandardCharsets.US_ASCII);
  }
}
