package ca.gc.cra.ember.domain.device;

import java.util.Objects;

/**
 * Result of one command dispatch.
 *
 * @param command attempted command
 * @param success whether the device acknowledged the command
 * @param latencyMillis elapsed time from connect to acknowledgement or failure
 * @param detail acknowledgement line on success, failure cause otherwise
 */
public record DispatchOutcome(Command command, boolean success, long latencyMillis, String detail) {
  public DispatchOutcome {
    Objects.requireNonNull(command, "command");
    detail = detail == null ? "" : detail;
  }

  public static DispatchOutcome success(Command command, long latencyMillis, String ack) {
    return new DispatchOutcome(command, true, latencyMillis, ack);
  }

  public static DispatchOutcome failure(Command command, long latencyMillis, String cause) {
    return new DispatchOutcome(command, false, latencyMillis, cause);
  }
}
