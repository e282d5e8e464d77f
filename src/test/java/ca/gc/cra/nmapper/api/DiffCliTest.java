package ca.gc.cra.nmapper.api;

import static ca.gc.cra.nmapper.testing.Fixtures.device;
import static ca.gc.cra.nmapper.testing.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.infrastructure.json.JsonCodec;
import ca.gc.cra.nmapper.infrastructure.persistence.jdbc.JdbcSnapshotStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DiffCliTest {
  private final String url = "jdbc:h2:mem:diff-cli-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
  }

  @Test
  void comparesTwoSnapshotsById() {
    seed(true);

    assertEquals(ExitCode.SUCCESS, run("from=snap-a", "to=snap-b"));
    String output = buffer.toString();
    assertTrue(output.contains("Diff snap-a -> snap-b"));
    assertTrue(output.contains("1 added, 0 removed"));
    assertTrue(output.contains("+ 10.0.0.2 [DEVICE_JOINED]"));
  }

  @Test
  void latestComparesTheTwoNewestAndIsRecordedAsRecent() {
    seed(true);

    assertEquals(ExitCode.SUCCESS, run("--latest"));
    assertTrue(buffer.toString().contains("Diff snap-a -> snap-b"));

    buffer.getBuffer().setLength(0);
    assertEquals(ExitCode.SUCCESS, run("recent=1"));
    assertTrue(buffer.toString().contains("snap-a -> snap-b"));
  }

  @Test
  void recentWithoutChangesSaysSo() {
    seed(true);

    assertEquals(ExitCode.SUCCESS, run("recent=24"));
    assertTrue(buffer.toString().contains("No changes recorded in that window."));
  }

  @Test
  void latestNeedsTwoSnapshots() {
    seed(false);

    assertEquals(ExitCode.NOT_FOUND, run("--latest"));
  }

  @Test
  void unknownSnapshotIsNotFound() {
    seed(true);

    assertEquals(ExitCode.NOT_FOUND, run("from=snap-a", "to=missing"));
  }

  @Test
  void jsonOutputCarriesTheSummary() {
    seed(true);

    assertEquals(ExitCode.SUCCESS, run("from=snap-a", "to=snap-b", "format=json"));
    assertTrue(buffer.toString().contains("\"devicesAdded\" : 1"));
  }

  @Test
  void selectionMustBeExactlyOneMode() {
    assertEquals(ExitCode.INVALID_ARGS, run());
    assertEquals(ExitCode.INVALID_ARGS, run("from=snap-a"));
    assertEquals(ExitCode.INVALID_ARGS, run("--latest", "recent=5"));
    assertTrue(buffer.toString().contains("usage: diff"));
  }

  @Test
  void recentWindowIsBounded() {
    assertEquals(ExitCode.INVALID_ARGS, run("recent=0"));
    assertEquals(ExitCode.INVALID_ARGS, run("recent=9000"));
  }

  private void seed(boolean both) {
    Instant now = Instant.now();
    JdbcSnapshotStore store = new JdbcSnapshotStore(url, "nmapper", "", new JsonCodec(), MetricsPort.NO_OP);
    store.initialize();
    store.create(snapshot("snap-a", now.minus(Duration.ofMinutes(20)), device("10.0.0.1", 22)));
    if (both) {
      store.create(snapshot("snap-b", now.minus(Duration.ofMinutes(10)),
          device("10.0.0.1", 22), device("10.0.0.2", 80)));
    }
    store.close();
  }

  private ExitCode run(String... extra) {
    String[] base = {"storage.type=jdbc", "storage.url=" + url, "notify.sink=none", "metricsExporter=none"};
    String[] args = new String[base.length + extra.length];
    System.arraycopy(base, 0, args, 0, base.length);
    System.arraycopy(extra, 0, args, base.length, extra.length);
    return DiffCli.run(args);
  }
}
