package ca.gc.cra.ember.domain.device;

import java.util.Objects;

/**
 * One dispatch attempt of a command to a device.
 *
 * @param type command type
 * @param device target device
 * @param dispatchedAtMillis epoch millis at which the attempt started
 */
public record Command(CommandType type, Device device, long dispatchedAtMillis) {
  public Command {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(device, "device");
  }
}
