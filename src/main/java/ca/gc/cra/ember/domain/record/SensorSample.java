package ca.gc.cra.ember.domain.record;

import ca.gc.cra.ember.validation.Numbers;

/**
 * Analog sensor reading from a field unit.
 *
 * @param adc1 smoke/gas channel, 12-bit ADC count
 * @param adc2 analog flame channel, 12-bit ADC count
 * @param flame digital flame input ({@code MPY30})
 * @param timestampMillis receive time in epoch milliseconds
 */
public record SensorSample(int adc1, int adc2, boolean flame, long timestampMillis)
    implements DecodedRecord {
  public static final int ADC_MAX = 4095;

  public SensorSample {
    Numbers.requireRange("adc1", adc1, 0, ADC_MAX);
    Numbers.requireRange("adc2", adc2, 0, ADC_MAX);
  }

  public double smokePercent() {
    return adc1 * 100.0d / ADC_MAX;
  }

  public double flamePercent() {
    return adc2 * 100.0d / ADC_MAX;
  }

  public double gasPpm() {
    return GasCurve.ppm(adc1);
  }

  @Override
  public String kind() {
    return "sensor";
  }
}
