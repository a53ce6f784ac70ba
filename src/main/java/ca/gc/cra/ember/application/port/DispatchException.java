package ca.gc.cra.ember.application.port;

/**
 * Raised when a device cannot be reached, times out, or rejects a command.
 */
public class DispatchException extends Exception {
  private static final long serialVersionUID = 1L;

  public DispatchException(String message) {
    super(message);
  }

  public DispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
