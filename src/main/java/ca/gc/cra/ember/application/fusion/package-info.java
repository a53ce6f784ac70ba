/**
 * Multi-source sensor fusion: per-location state, hot-cell decay, debounce hold, confidence policies, and the
 * per-location mailbox dispatcher.
 * <p><strong>Concurrency:</strong> Each location has a single writer at a time; different locations fuse in
 * parallel.</p>
 */
package ca.gc.cra.ember.application.fusion;
