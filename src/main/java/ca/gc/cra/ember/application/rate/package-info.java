/**
 * Adaptive frame-rate control driven by backlog depth.
 */
package ca.gc.cra.ember.application.rate;
