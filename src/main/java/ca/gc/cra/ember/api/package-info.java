/**
 * CLI entry points: {@code serve}, {@code devices}, {@code simulate}, and {@code ratesim}.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, merges YAML configuration, configures
 * logging and telemetry, and starts the composition root.</p>
 * <p><strong>Concurrency:</strong> Commands run their setup on the calling thread; services spawn their own workers.</p>
 */
package ca.gc.cra.ember.api;
