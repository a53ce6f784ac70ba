package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.domain.fusion.FusionResult;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.domain.record.ThermalFrame;

/**
 * Mutable per-location fusion state. Every access happens while holding the instance monitor.
 */
final class FusionState {
  final String locationId;
  final HotCellGrid hotCells;
  double lastFrameMaxCelsius = Double.NaN;
  double gasPpm = Double.NaN;
  double smokePercent = Double.NaN;
  double flamePercent = Double.NaN;
  boolean flame;
  long framesApplied;
  long samplesApplied;
  String serial;
  FusionResult lastResult;
  FusionResult latched;
  long holdUntilMillis = Long.MIN_VALUE;

  FusionState(String locationId, long hotCellDecayMillis) {
    this.locationId = locationId;
    this.hotCells = new HotCellGrid(hotCellDecayMillis);
  }

  void applyFrame(ThermalFrame frame, double thresholdCelsius, long nowMillis) {
    hotCells.update(frame, thresholdCelsius, nowMillis);
    lastFrameMaxCelsius = frame.maxCelsius();
    framesApplied++;
  }

  void applySample(SensorSample sample, boolean gasFromAdc1) {
    if (gasFromAdc1) {
      gasPpm = sample.gasPpm();
    }
    smokePercent = sample.smokePercent();
    flamePercent = sample.flamePercent();
    flame = sample.flame();
    samplesApplied++;
  }

  /**
   * Thermal channel reading: the hottest debounced cell, or the latest frame maximum when nothing is hot.
   */
  double thermalReading(long nowMillis) {
    double hottest = hotCells.hottest(nowMillis);
    return Double.isNaN(hottest) ? lastFrameMaxCelsius : hottest;
  }

  boolean holding(long nowMillis) {
    return latched != null && nowMillis < holdUntilMillis;
  }

  FusionSnapshot snapshot(long nowMillis) {
    return new FusionSnapshot(
        locationId,
        serial,
        thermalReading(nowMillis),
        hotCells.hotCount(nowMillis),
        gasPpm,
        smokePercent,
        flamePercent,
        flame,
        framesApplied,
        samplesApplied,
        holding(nowMillis),
        lastResult);
  }
}
