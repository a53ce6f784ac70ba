package ca.gc.cra.ember.application.port;

/**
 * Notified when a field unit connects to the ingestion server.
 */
@FunctionalInterface
public interface ConnectionListener {
  /**
   * Called on the connection thread after the socket is accepted.
   *
   * @param peerAddress textual IP address of the peer
   */
  void onConnected(String peerAddress);
}
