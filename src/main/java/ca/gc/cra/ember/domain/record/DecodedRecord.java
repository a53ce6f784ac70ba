package ca.gc.cra.ember.domain.record;

/**
 * Typed record produced from a single wire packet. Implementations are immutable.
 *
 * @since 0.1.0
 */
public sealed interface DecodedRecord
    permits Identity, ThermalFrame, SensorSample, CalibrationBlock {

  /**
   * Short type label used for metrics and log lines.
   *
   * @return stable lowercase label
   */
  String kind();
}
