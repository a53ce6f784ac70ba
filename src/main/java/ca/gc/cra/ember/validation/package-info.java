/**
 * Argument validators shared by configuration records and CLI commands. Failures surface as
 * {@link java.lang.IllegalArgumentException}.
 */
package ca.gc.cra.ember.validation;
