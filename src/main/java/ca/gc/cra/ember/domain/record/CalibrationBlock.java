package ca.gc.cra.ember.domain.record;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Calibration memory dump returned by a field unit in reply to {@code EEPROM1}.
 *
 * <p>Word 0 holds the device temperature offset in signed centi-degrees; the remaining words are kept
 * verbatim.</p>
 */
public final class CalibrationBlock implements DecodedRecord {
  public static final int WORDS = 832;
  static final double MAX_OFFSET_CELSIUS = 100.0d;

  private final String deviceTag;
  private final int[] words;

  /**
   * Creates a block.
   *
   * @param deviceTag identifier that followed the {@code EEPROM} tag on the wire; may be empty
   * @param words {@value #WORDS} unsigned 16-bit words; copied
   */
  public CalibrationBlock(String deviceTag, int[] words) {
    if (words == null || words.length != WORDS) {
      throw new IllegalArgumentException(
          "calibration block requires " + WORDS + " words (was " + (words == null ? 0 : words.length) + ")");
    }
    this.deviceTag = deviceTag == null ? "" : deviceTag.trim();
    this.words = words.clone();
  }

  public String deviceTag() {
    return deviceTag;
  }

  public int[] words() {
    return words.clone();
  }

  /**
   * Device temperature correction, present only when word 0 decodes to a plausible value.
   *
   * @return offset in degrees Celsius within [-100, 100], or empty when out of range
   */
  public OptionalDouble deviceOffsetCelsius() {
    double offset = ((short) words[0]) / 100.0d;
    if (offset < -MAX_OFFSET_CELSIUS || offset > MAX_OFFSET_CELSIUS) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(offset);
  }

  @Override
  public String kind() {
    return "calibration";
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CalibrationBlock block
        && deviceTag.equals(block.deviceTag)
        && Arrays.equals(words, block.words);
  }

  @Override
  public int hashCode() {
    return 31 * deviceTag.hashCode() + Arrays.hashCode(words);
  }

  @Override
  public String toString() {
    return "CalibrationBlock[tag=" + deviceTag + ", words=" + WORDS + "]";
  }
}
