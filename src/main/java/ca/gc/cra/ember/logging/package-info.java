/**
 * Logging helpers: runtime level changes, safe log excerpts, and rate limiting of repeated failures.
 */
package ca.gc.cra.ember.logging;
