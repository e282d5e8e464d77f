package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry keys of the merged configuration into the {@code otel.*} system properties read by the
 * metrics bootstrap. The keys are removed from the map so typed config parsing never sees them.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}. Blank values leave
   * the corresponding property untouched.
   *
   * @param options mutable merged configuration
   * @throws IllegalArgumentException if the exporter is unknown, the endpoint is not an http(s) URI or the
   *     resource attributes are not printable ASCII
   */
  static void configureMetrics(Map<String, String> options) {
    if (options == null || options.isEmpty()) {
      return;
    }
    String exporter = blankToNull(options.remove("metricsExporter"));
    if (exporter != null) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter + ")");
      }
      System.setProperty(EXPORTER_PROPERTY, normalized);
      log.debug("Metrics exporter: {}", normalized);
    }

    String endpoint = blankToNull(options.remove("otelEndpoint"));
    if (endpoint != null) {
      requireHttpEndpoint(endpoint);
      System.setProperty(ENDPOINT_PROPERTY, endpoint);
      log.debug("OTLP endpoint: {}", endpoint);
    }

    String attributes = blankToNull(options.remove("otelResourceAttributes"));
    if (attributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty(RESOURCE_PROPERTY, attributes);
      log.debug("OTel resource attributes overridden");
    }
  }

  private static void requireHttpEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
