package ca.gc.cra.ember.application.port;

import ca.gc.cra.ember.domain.device.CommandType;
import ca.gc.cra.ember.domain.device.Device;

/**
 * <strong>What:</strong> Port that delivers one command to one device and waits for its acknowledgement.
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent sends to different devices. The
 * scheduler guarantees at most one in-flight send per device.</p>
 *
 * @since 0.1.0
 */
public interface CommandTransport {
  /**
   * Sends a command and blocks until acknowledged or failed.
   *
   * @param device target device
   * @param command command to send
   * @return acknowledgement line sent back by the device
   * @throws DispatchException when the device is unreachable, times out, or rejects the command
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  String send(Device device, CommandType command) throws DispatchException, InterruptedException;
}
