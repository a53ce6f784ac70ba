/**
 * Device adapters: YAML registry storage and the TCP command transport.
 */
package ca.gc.cra.ember.infrastructure.device;
