/**
 * Configuration values, loading, merging, and wiring.
 * <p><strong>Precedence:</strong> programmatic overrides, then the YAML file ({@code common} plus the active
 * environment section), then {@link ca.gc.cra.prism.config.DefaultsForEnvironment}.</p>
 * <p><strong>Validation:</strong> Values are checked when {@link ca.gc.cra.prism.config.ObservabilityConfig} is built;
 * invalid input raises {@link IllegalArgumentException} before anything starts.</p>
 * <p><strong>Wiring:</strong> {@link ca.gc.cra.prism.config.CompositionRoot} owns the only instance of every
 * service.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.config;
