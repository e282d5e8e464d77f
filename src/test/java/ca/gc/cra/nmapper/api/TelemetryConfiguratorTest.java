package ca.gc.cra.nmapper.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  @AfterEach
  void clearProperties() {
    System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
    System.clearProperty(TelemetryConfigurator.ENDPOINT_PROPERTY);
    System.clearProperty(TelemetryConfigurator.RESOURCE_PROPERTY);
  }

  @Test
  void appliesAndRemovesTelemetryKeys() {
    Map<String, String> options = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "service.name=nmapper",
        "storage.type", "memory"));

    TelemetryConfigurator.configureMetrics(options);

    assertEquals(Map.of("storage.type", "memory"), options);
    assertEquals("otlp", System.getProperty(TelemetryConfigurator.EXPORTER_PROPERTY));
    assertEquals("http://collector:4317", System.getProperty(TelemetryConfigurator.ENDPOINT_PROPERTY));
    assertEquals("service.name=nmapper", System.getProperty(TelemetryConfigurator.RESOURCE_PROPERTY));
  }

  @Test
  void blankValuesLeavePropertiesAlone() {
    Map<String, String> options = new HashMap<>(Map.of("metricsExporter", " ", "otelEndpoint", ""));

    TelemetryConfigurator.configureMetrics(options);

    assertNull(System.getProperty(TelemetryConfigurator.EXPORTER_PROPERTY));
    assertNull(System.getProperty(TelemetryConfigurator.ENDPOINT_PROPERTY));
  }

  @Test
  void rejectsUnknownExporter() {
    Map<String, String> options = new HashMap<>(Map.of("metricsExporter", "prometheus"));

    assertThrows(IllegalArgumentException.class, () -> TelemetryConfigurator.configureMetrics(options));
  }

  @Test
  void rejectsNonHttpEndpoint() {
    Map<String, String> options = new HashMap<>(Map.of("otelEndpoint", "grpc://collector:4317"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(options));
    assertTrue(ex.getMessage().contains("http"));
  }
}
