package ca.gc.cra.ember.infrastructure.events;

import ca.gc.cra.ember.application.port.DispatchListener;
import ca.gc.cra.ember.domain.device.Command;
import ca.gc.cra.ember.domain.device.DispatchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records every dispatch outcome at debug level on the {@code ember.dispatch} logger; operators enable it to
 * audit device traffic.
 */
public final class LoggingDispatchListener implements DispatchListener {
  private static final Logger log = LoggerFactory.getLogger("ember.dispatch");

  @Override
  public void onDispatch(DispatchOutcome outcome) {
    if (!log.isDebugEnabled()) {
      return;
    }
    Command command = outcome.command();
    log.debug("dispatch command={}, device={}, ip={}, success={}, latencyMs={}, detail={}",
        command.type(),
        command.device().id(),
        command.device().ip(),
        outcome.success(),
        outcome.latencyMillis(),
        outcome.detail());
  }
}
