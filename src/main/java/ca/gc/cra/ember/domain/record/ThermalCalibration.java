package ca.gc.cra.ember.domain.record;

import ca.gc.cra.ember.validation.Numbers;

/**
 * Conversion from a raw 16-bit thermal word to degrees Celsius: {@code value = raw * scale + offset}.
 *
 * <p>The field units report signed centi-degrees relative to 27 °C, which is the default calibration.</p>
 *
 * @param signed interpret raw words as two's complement when {@code true}
 * @param scale multiplier applied to the raw word
 * @param offset additive offset in degrees Celsius
 */
public record ThermalCalibration(boolean signed, double scale, double offset) {
  public static final double DEFAULT_SCALE = 0.01d;
  public static final double DEFAULT_OFFSET = 27.0d;

  public ThermalCalibration {
    Numbers.requireRange("thermal.scale", scale, 1e-6d, 1_000d);
    Numbers.requireRange("thermal.offset", offset, -1_000d, 1_000d);
  }

  public static ThermalCalibration defaults() {
    return new ThermalCalibration(true, DEFAULT_SCALE, DEFAULT_OFFSET);
  }

  /**
   * Converts one raw word.
   *
   * @param word unsigned 16-bit value as read from the wire (0..0xFFFF)
   * @return calibrated temperature in degrees Celsius
   */
  public double apply(int word) {
    int raw = signed ? (short) word : word & 0xFFFF;
    return raw * scale + offset;
  }

  /**
   * Returns a copy with a per-device correction added to the offset.
   *
   * @param deviceOffset correction in degrees Celsius
   * @return adjusted calibration
   */
  public ThermalCalibration withDeviceOffset(double deviceOffset) {
    return new ThermalCalibration(signed, scale, offset + deviceOffset);
  }
}
