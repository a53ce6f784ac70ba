/**
 * Ports connecting the application core to clocks, metrics, transports, registry storage, and listeners.
 * <p><strong>Role:</strong> Interfaces implemented by infrastructure adapters and by test doubles.</p>
 */
package ca.gc.cra.ember.application.port;
