/**
 * Device registry and the ticking scheduler that dispatches {@code PERIOD_ON}, {@code REQUEST1}, and
 * {@code EEPROM1} commands.
 */
package ca.gc.cra.ember.application.schedule;
