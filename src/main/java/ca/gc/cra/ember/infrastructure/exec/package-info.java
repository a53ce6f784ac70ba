/**
 * Named executor factories.
 */
package ca.gc.cra.ember.infrastructure.exec;
