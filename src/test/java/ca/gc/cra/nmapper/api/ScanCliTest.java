package ca.gc.cra.nmapper.api;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ScanCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    logger = (Logger) LoggerFactory.getLogger(ScanCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
    System.clearProperty(TelemetryConfigurator.EXPORTER_PROPERTY);
  }

  @Test
  void missingRangeReturnsInvalidArgs() {
    ExitCode code = ScanCli.run(new String[] {"scanner.command=nmap-json {target}"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: scan"));
    assertTrue(logged("range is required"));
  }

  @Test
  void missingScannerReturnsInvalidArgs() {
    ExitCode code = ScanCli.run(new String[] {"range=10.0.0.0/24"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged("scanner.command is required"));
  }

  @Test
  void malformedRangeIsRejected() {
    ExitCode code = ScanCli.run(new String[] {"range=10.0.0.0/99", "scanner.command=nmap-json {target}"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged("Invalid scan request"));
  }

  @Test
  void timeoutOutsideBoundsIsRejected() {
    ExitCode code = ScanCli.run(new String[] {
        "range=10.0.0.5", "timeout=2h", "scanner.command=nmap-json {target}"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void dryRunPrintsPlanWithoutScanning() {
    ExitCode code = ScanCli.run(new String[] {
        "range=10.0.0.0/24", "profile=quick", "scanner.command=nmap-json {target}", "storage.password=hunter2",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Scan dry-run"));
    assertTrue(output.contains("10.0.0.0/24"));
    assertTrue(output.contains("quick"));
    assertFalse(output.contains("hunter2"));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void scansAndPrintsTheStoredSnapshot() throws Exception {
    Path scanner = script("scanner.sh",
        "printf '[{\"ip\":\"%s\",\"active\":true,\"hostname\":\"edge\","
            + "\"ports\":[{\"number\":22,\"protocol\":\"tcp\",\"state\":\"open\"}]}]' \"$1\"");

    ExitCode code = ScanCli.run(new String[] {
        "range=10.0.0.7",
        "scanner.command=" + scanner + " {target}",
        "storage.type=memory",
        "notify.sink=none",
        "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Snapshot "));
    assertTrue(output.contains("Devices       : 1"));
    assertTrue(output.contains("Ports         : 1"));
    assertTrue(output.contains("No previous snapshot"));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void failingScannerMapsToScanFailed() throws Exception {
    Path scanner = script("broken.sh", "echo 'host unreachable' >&2; exit 3");

    ExitCode code = ScanCli.run(new String[] {
        "range=10.0.0.7",
        "scanner.command=" + scanner + " {target}",
        "scheduler.maxRetries=0",
        "storage.type=memory",
        "notify.sink=none",
        "metricsExporter=none"});

    assertEquals(ExitCode.SCAN_FAILED, code);
    assertTrue(logged("Scan failed"));
  }

  private Path script(String name, String body) throws Exception {
    Path file = tempDir.resolve(name);
    Files.writeString(file, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
    assertTrue(file.toFile().setExecutable(true));
    return file;
  }

  private boolean logged(String fragment) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
