/**
 * Command-line entry points: {@code monitor}, {@code scan}, {@code snapshots} and {@code diff}.
 * <p><strong>Role:</strong> Driving adapters. Each command merges defaults, YAML and {@code key=value} arguments,
 * builds the object graph through {@link ca.gc.cra.nmapper.config.CompositionRoot} and maps failures onto
 * {@link ca.gc.cra.nmapper.api.ExitCode} values.</p>
 * <p><strong>Output:</strong> Results go to stdout via {@link ca.gc.cra.nmapper.api.CliPrinter}; diagnostics go to
 * the SLF4J log.</p>
 */
package ca.gc.cra.nmapper.api;
