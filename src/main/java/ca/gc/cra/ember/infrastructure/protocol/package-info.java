/**
 * Field-unit wire protocol: packet decoder, encoder, and thermal hex codec.
 */
package ca.gc.cra.ember.infrastructure.protocol;
