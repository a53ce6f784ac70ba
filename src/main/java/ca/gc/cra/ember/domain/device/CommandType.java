package ca.gc.cra.ember.domain.device;

/**
 * Plaintext commands understood by response devices.
 */
public enum CommandType {
  /** On-demand status request. */
  REQUEST1,
  /** Enables continuous reporting. */
  PERIOD_ON,
  /** Requests the calibration memory dump. */
  EEPROM1;

  /**
   * Wire form of the command, newline terminated.
   *
   * @return command line
   */
  public String wireLine() {
    return name() + "\n";
  }
}
