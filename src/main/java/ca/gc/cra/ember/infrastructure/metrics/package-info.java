/**
 * Metrics adapters: an in-process collector mirrored into OpenTelemetry instruments with Prometheus or OTLP export.
 */
package ca.gc.cra.ember.infrastructure.metrics;
