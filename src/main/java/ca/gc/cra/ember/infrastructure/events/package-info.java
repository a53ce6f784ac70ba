/**
 * Listeners that log fusion alarms and dispatch outcomes.
 */
package ca.gc.cra.ember.infrastructure.events;
