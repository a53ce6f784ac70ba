package ca.gc.cra.ember.application.port;

import ca.gc.cra.ember.domain.device.DispatchOutcome;

/**
 * Receives the outcome of every command dispatch. Called from dispatch worker threads.
 */
@FunctionalInterface
public interface DispatchListener {
  void onDispatch(DispatchOutcome outcome);
}
