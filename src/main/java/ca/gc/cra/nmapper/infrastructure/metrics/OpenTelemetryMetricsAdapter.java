package ca.gc.cra.nmapper.infrastructure.metrics;

import ca.gc.cra.nmapper.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes monitor counters as OpenTelemetry counters and observations as long histograms.
 * <p>Instrument names are the metric keys lower-cased with unsupported characters replaced; the original key is
 * attached as the {@code nmapper.metric.key} attribute. Instruments are created lazily and cached.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("nmapper.metric.key");

  private final OpenTelemetryBootstrap.Telemetry telemetry;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from {@code otel.*} properties and {@code OTEL_*} variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Telemetry telemetry) {
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.meter = telemetry.meter();
    if (!telemetry.exporting()) {
      log.info("Metrics adapter running without an exporter");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.counterBuilder(instrumentName(k)).setUnit("1")
            .setDescription("nmapper counter " + k).build(), Attributes.of(METRIC_KEY, k)));
    counter.instrument().add(1L, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), k ->
        new Instrument<>(meter.histogramBuilder(instrumentName(k)).ofLongs()
            .setDescription("nmapper observation " + k).build(), Attributes.of(METRIC_KEY, k)));
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes pending data points to the exporter. */
  public void flush() {
    telemetry.flush();
  }

  @Override
  public void close() {
    telemetry.close();
  }

  static String instrumentName(String key) {
    String trimmed = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return "nmapper.metric";
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (char c : trimmed.toCharArray()) {
      boolean allowed = Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-';
      name.append(allowed ? c : '_');
    }
    return name.toString();
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
