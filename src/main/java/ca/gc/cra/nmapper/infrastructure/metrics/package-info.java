/**
 * OpenTelemetry implementation of {@link ca.gc.cra.nmapper.application.port.MetricsPort}.
 * <p>Exporter selection follows the standard {@code otel.*} system properties and {@code OTEL_*} environment
 * variables; the CLI maps its {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}
 * options onto the system properties before the adapter is created.</p>
 */
package ca.gc.cra.nmapper.infrastructure.metrics;
