package ca.gc.cra.ember.domain.record;

/**
 * MQ-135 CO2 response curve used to turn a 12-bit ADC reading into a gas concentration.
 */
public final class GasCurve {
  static final double LOAD_RESISTANCE_KOHM = 10.0d;
  static final double REFERENCE_RESISTANCE_KOHM = 76.63d;
  static final double SUPPLY_VOLTS = 5.0d;
  static final double ADC_RESOLUTION = 4096.0d;
  static final double CURVE_A = 116.6020682d;
  static final double CURVE_B = -2.769034857d;
  static final double MIN_SENSOR_RESISTANCE_KOHM = 0.1d;

  private GasCurve() {}

  /**
   * Converts an ADC reading to ppm.
   *
   * @param adc raw ADC count (0..4095)
   * @return estimated CO2 concentration in ppm
   */
  public static double ppm(int adc) {
    double vout = Math.max(adc, 1) / ADC_RESOLUTION * SUPPLY_VOLTS;
    double rs = (SUPPLY_VOLTS * LOAD_RESISTANCE_KOHM / vout) - LOAD_RESISTANCE_KOHM;
    rs = Math.max(rs, MIN_SENSOR_RESISTANCE_KOHM);
    return CURVE_A * Math.pow(rs / REFERENCE_RESISTANCE_KOHM, CURVE_B);
  }
}
