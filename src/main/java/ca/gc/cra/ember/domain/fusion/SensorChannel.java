package ca.gc.cra.ember.domain.fusion;

/**
 * Independently thresholded inputs combined by the fusion engine.
 */
public enum SensorChannel {
  TEMPERATURE,
  GAS,
  SMOKE,
  FLAME,
  VISION
}
