package ca.gc.cra.nmapper.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.nmapper.application.port.ClockPort;
import ca.gc.cra.nmapper.application.port.NotificationPort;
import ca.gc.cra.nmapper.domain.monitoring.OrchestratorState;
import ca.gc.cra.nmapper.infrastructure.notify.LoggingNotificationAdapter;
import ca.gc.cra.nmapper.infrastructure.persistence.jdbc.JdbcSnapshotStore;
import ca.gc.cra.nmapper.infrastructure.persistence.memory.InMemorySnapshotStore;
import ca.gc.cra.nmapper.infrastructure.scanner.CommandScannerAdapter;
import ca.gc.cra.nmapper.infrastructure.scanner.DisabledScannerAdapter;
import ca.gc.cra.nmapper.testing.RecordingMetricsPort;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void wiresInMemoryGraph() {
    MonitorConfig config = MonitorConfig.fromMap(Map.of("storage.type", "memory", "notify.sink", "none"));

    try (CompositionRoot root = new CompositionRoot(config, new RecordingMetricsPort(), ClockPort.SYSTEM)) {
      assertInstanceOf(InMemorySnapshotStore.class, root.snapshotStore());
      assertInstanceOf(DisabledScannerAdapter.class, root.scanner());
      assertSame(NotificationPort.NO_OP, root.notifications());
      assertSame(root.snapshotStore(), root.snapshotStore());
      assertSame(root.orchestrator(), root.orchestrator());

      root.orchestrator().start();
      assertEquals(OrchestratorState.RUNNING, root.orchestrator().state());
      assertFalse(root.orchestrator().checkHealth().component("scanner").orElseThrow().healthy());
    }
  }

  @Test
  void selectsConfiguredAdapters() {
    MonitorConfig config = MonitorConfig.fromMap(Map.of(
        "storage.url", "jdbc:h2:mem:root-wiring;DB_CLOSE_DELAY=-1",
        "scanner.command", "nmap-json {target}",
        "notify.sink", "log"));

    try (CompositionRoot root = new CompositionRoot(config, new RecordingMetricsPort(), ClockPort.SYSTEM)) {
      assertInstanceOf(JdbcSnapshotStore.class, root.snapshotStore());
      assertInstanceOf(CommandScannerAdapter.class, root.scanner());
      assertEquals("nmap-json {target}", root.scanner().describe());
      assertInstanceOf(LoggingNotificationAdapter.class, root.notifications());
    }
  }

  @Test
  void closeStopsTheOrchestrator() {
    MonitorConfig config = MonitorConfig.fromMap(Map.of("storage.type", "memory"));
    CompositionRoot root = new CompositionRoot(config, new RecordingMetricsPort(), ClockPort.SYSTEM);
    root.orchestrator().start();

    root.close();

    assertEquals(OrchestratorState.STOPPED, root.orchestrator().state());
  }
}
