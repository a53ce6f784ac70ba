/**
 * TCP ingestion server, per-connection handling, packet framing, and the field-unit simulator.
 * <p><strong>Concurrency:</strong> One thread per connection on a bounded pool; connections beyond the limit are
 * closed immediately.</p>
 */
package ca.gc.cra.ember.infrastructure.net;
