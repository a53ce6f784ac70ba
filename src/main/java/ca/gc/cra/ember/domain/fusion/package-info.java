/**
 * Fusion decisions and the sensor channels they are built from.
 */
package ca.gc.cra.ember.domain.fusion;
