package ca.gc.cra.ember.infrastructure.net;

import ca.gc.cra.ember.validation.Net;
import ca.gc.cra.ember.validation.Numbers;

/**
 * Ingestion listener parameters.
 *
 * @param bindHost listen address
 * @param port listen port; {@code 0} picks an ephemeral port
 * @param maxConnections concurrent connections served; further ones are refused
 * @param maxPacketBytes longest accepted line
 * @param readTimeoutMillis socket read timeout used to re-check shutdown
 * @param useDeviceOffset apply the offset from a received calibration block to later frames of the connection
 * @param autoPeriodOnConnect write {@code PERIOD_ON} to every newly connected field unit
 */
public record IngestSettings(
    String bindHost,
    int port,
    int maxConnections,
    int maxPacketBytes,
    int readTimeoutMillis,
    boolean useDeviceOffset,
    boolean autoPeriodOnConnect) {
  public static final int DEFAULT_PORT = 9000;

  public IngestSettings {
    bindHost = Net.requireHost("ingest.bindHost", bindHost);
    Net.requirePort("ingest.port", port, true);
    Numbers.requireRange("ingest.maxConnections", maxConnections, 1, 4_096);
    Numbers.requireRange("ingest.maxPacketBytes", maxPacketBytes, 64, 1 << 20);
    Numbers.requireRange("ingest.readTimeoutMillis", readTimeoutMillis, 10, 600_000);
  }

  public static IngestSettings defaults() {
    return new IngestSettings("0.0.0.0", DEFAULT_PORT, 64, 16_384, 30_000, false, false);
  }

  public IngestSettings withPort(int newPort) {
    return new IngestSettings(
        bindHost, newPort, maxConnections, maxPacketBytes, readTimeoutMillis, useDeviceOffset, autoPeriodOnConnect);
  }
}
