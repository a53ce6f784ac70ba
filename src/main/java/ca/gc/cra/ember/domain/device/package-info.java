/**
 * Response devices, their reporting modes, and the commands dispatched to them.
 */
package ca.gc.cra.ember.domain.device;
