package ca.gc.cra.nmapper.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void countersCarryTheMetricKeyAndServiceResource() {
    adapter.increment("monitor.snapshot.stored");
    adapter.increment("monitor.snapshot.stored");
    adapter.flush();

    MetricData counter = metric("monitor.snapshot.stored");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("monitor.snapshot.stored", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY));
    assertEquals("nmapper", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank());
  }

  @Test
  void observationsBecomeHistograms() {
    adapter.observe("scanner.process.durationMillis", 120L);
    adapter.observe("scanner.process.durationMillis", 80L);

    MetricData histogram = metric("scanner.process.durationmillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200.0, point.getSum(), 0.001);
    assertEquals("scanner.process.durationMillis", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY));
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("monitor.health.storage", OpenTelemetryMetricsAdapter.instrumentName("monitor.health.storage"));
    assertEquals("breaker.store_opened", OpenTelemetryMetricsAdapter.instrumentName(" Breaker.Store Opened "));
    assertEquals("m1.retry", OpenTelemetryMetricsAdapter.instrumentName("1.retry"));
    assertEquals("nmapper.metric", OpenTelemetryMetricsAdapter.instrumentName("  "));
  }

  @Test
  void resourceAttributesAreParsedLeniently() {
    Attributes attributes = OpenTelemetryBootstrap.parseAttributes("deployment.environment=lab, broken ,team=");

    assertEquals("lab", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals(1, attributes.size());
    assertTrue(OpenTelemetryBootstrap.parseAttributes(" ").isEmpty());
  }

  @Test
  void noopTelemetryAcceptsMetricsWithoutExporting() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Telemetry.noop());

    noop.increment("monitor.start.success");
    noop.observe("monitor.diff.totalChanges", 3L);
    noop.flush();
    noop.close();

    assertFalse(OpenTelemetryBootstrap.Telemetry.noop().exporting());
  }

  private MetricData metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
