/**
 * <strong>Purpose:</strong> Configuration loading and wiring. Defaults, YAML and CLI {@code key=value} pairs are
 * merged into one flat map, parsed into {@link ca.gc.cra.nmapper.config.MonitorConfig}, and turned into a running
 * object graph by {@link ca.gc.cra.nmapper.config.CompositionRoot}.
 * <p><strong>Precedence:</strong> CLI over YAML over built-in defaults.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nmapper.config;
