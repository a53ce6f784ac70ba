package ca.gc.cra.ember.application.port;

import ca.gc.cra.ember.domain.fusion.FusionResult;

/**
 * Receives alarm decisions. Invoked once per newly raised alarm, on the fusion thread of the location.
 */
@FunctionalInterface
public interface AlarmListener {
  void onAlarm(FusionResult result);
}
