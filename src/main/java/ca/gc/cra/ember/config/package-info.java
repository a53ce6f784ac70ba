/**
 * Configuration loading, merging, and the composition root that wires the service graph.
 * <p><strong>Precedence:</strong> CLI arguments override YAML, which overrides the defaults in {@link
 * ca.gc.cra.ember.config.DefaultsForMode}.</p>
 */
package ca.gc.cra.ember.config;
