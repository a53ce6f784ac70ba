/**
 * Records decoded from field-unit packets: identities, thermal frames, sensor samples, and calibration blocks.
 */
package ca.gc.cra.ember.domain.record;
