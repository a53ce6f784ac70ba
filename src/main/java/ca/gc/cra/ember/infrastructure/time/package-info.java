/**
 * System clock adapter.
 */
package ca.gc.cra.ember.infrastructure.time;
