package ca.gc.cra.nmapper.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter provider for the monitor from system properties and environment variables.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);

  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.nmapper";
  static final String SERVICE = "nmapper";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_WAIT_SECONDS = 5L;

  private OpenTelemetryBootstrap() {}

  /**
   * Creates a meter from {@code otel.metrics.exporter} / {@code OTEL_METRICS_EXPORTER}; any failure degrades to a
   * noop meter so metrics never block startup.
   */
  static Telemetry initialize() {
    String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp").toLowerCase(Locale.ROOT);
    if ("none".equals(exporter)) {
      log.info("Metrics export disabled (exporter=none)");
      return Telemetry.noop();
    }
    if (!"otlp".equals(exporter)) {
      log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
    }
    String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
    try {
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      Attributes extra = parseAttributes(
          setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
      Telemetry telemetry = build(reader, extra);
      log.info("Exporting metrics over OTLP to {}", endpoint);
      return telemetry;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return Telemetry.noop();
    }
  }

  /** Wires a caller-supplied reader, typically an in-memory reader in tests. */
  static Telemetry forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static Telemetry build(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    AttributesBuilder attributes = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), SERVICE)
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version)
        .put(AttributeKey.stringKey("service.instance.id"), instanceId());
    Resource resource = Resource.getDefault().merge(Resource.create(attributes.build()));
    if (!extra.isEmpty()) {
      resource = resource.merge(Resource.create(extra));
    }
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new Telemetry(meter, provider);
  }

  static Attributes parseAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String pair : raw.split(",")) {
      int eq = pair.indexOf('=');
      String key = eq > 0 ? pair.substring(0, eq).trim() : "";
      String value = eq > 0 ? pair.substring(eq + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        if (!pair.isBlank()) {
          log.warn("Ignoring malformed resource attribute '{}'", pair.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String setting(String property, String env, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  private static String instanceId() {
    String override = System.getenv("OTEL_RESOURCE_SERVICE_INSTANCE");
    if (override != null && !override.isBlank()) {
      return override.trim();
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable for service.instance.id", ex);
      return "unknown";
    }
  }

  /** Meter plus the provider that owns it; the provider is {@code null} in noop mode. */
  static final class Telemetry implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Telemetry(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Telemetry noop() {
      return new Telemetry(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean exporting() {
      return provider != null;
    }

    void flush() {
      if (provider != null && !provider.forceFlush().join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("Metrics flush did not finish within {} s", SHUTDOWN_WAIT_SECONDS);
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.shutdown().join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("Meter provider shutdown did not finish within {} s", SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
