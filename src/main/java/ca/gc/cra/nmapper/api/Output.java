package ca.gc.cra.nmapper.api;

import ca.gc.cra.nmapper.application.port.Page;
import ca.gc.cra.nmapper.application.port.ScanStatistics;
import ca.gc.cra.nmapper.domain.monitoring.ComponentHealth;
import ca.gc.cra.nmapper.domain.monitoring.HealthStatus;
import ca.gc.cra.nmapper.domain.monitoring.MonitoringMetrics;
import ca.gc.cra.nmapper.domain.snapshot.ChangeType;
import ca.gc.cra.nmapper.domain.snapshot.DeviceDiff;
import ca.gc.cra.nmapper.domain.snapshot.DiffSummary;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.PortDiff;
import ca.gc.cra.nmapper.domain.snapshot.PropertyChange;
import ca.gc.cra.nmapper.domain.snapshot.ServiceDiff;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.infrastructure.json.JsonCodec;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders command results as aligned text or pretty JSON ({@code format=json}).
 */
final class Output {
  private final boolean json;
  private final JsonCodec codec;

  private Output(boolean json, JsonCodec codec) {
    this.json = json;
    this.codec = codec;
  }

  /**
   * Resolves the {@code format} option.
   *
   * @param format {@code text}, {@code json} or {@code null} for text
   * @param codec codec used in JSON mode
   * @return renderer
   * @throws IllegalArgumentException for any other format
   */
  static Output forFormat(String format, JsonCodec codec) {
    String normalized = format == null ? "text" : format.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "text", "" -> new Output(false, codec);
      case "json" -> new Output(true, codec);
      default -> throw new IllegalArgumentException("format must be text or json (was " + format + ")");
    };
  }

  boolean json() {
    return json;
  }

  void snapshot(NetworkSnapshot snapshot, SnapshotDiff diffFromPrevious) {
    if (json) {
      CliPrinter.println(codec.writePretty(diffFromPrevious == null
          ? snapshot
          : Map.of("snapshot", snapshot, "diff", diffFromPrevious)));
      return;
    }
    CliPrinter.printLines(
        "Snapshot " + snapshot.id(),
        " Taken at      : " + snapshot.timestamp(),
        " Target        : " + snapshot.metadata().scanTarget() + " (" + snapshot.metadata().scanType() + ")",
        " Devices       : " + snapshot.deviceCount(),
        " Ports         : " + snapshot.totalPorts(),
        " Scan duration : " + snapshot.metadata().scanDurationMillis() + " ms",
        " Checksum      : " + snapshot.checksum());
    if (!snapshot.metadata().errors().isEmpty()) {
      CliPrinter.println(" Scan errors   : " + String.join("; ", snapshot.metadata().errors()));
    }
    if (diffFromPrevious == null) {
      CliPrinter.println(" No previous snapshot to compare with.");
    } else {
      CliPrinter.println(" Changes since " + diffFromPrevious.fromSnapshot() + ": "
          + summaryLine(diffFromPrevious.summary()));
    }
  }

  void snapshots(Page<NetworkSnapshot> page) {
    if (json) {
      CliPrinter.println(codec.writePretty(page));
      return;
    }
    if (page.items().isEmpty()) {
      CliPrinter.println("No snapshots stored.");
      return;
    }
    CliPrinter.printf("%-36s  %-24s  %7s  %7s  %s", "ID", "TAKEN AT", "DEVICES", "PORTS", "TARGET");
    for (NetworkSnapshot snapshot : page.items()) {
      CliPrinter.printf("%-36s  %-24s  %7d  %7d  %s", snapshot.id(), snapshot.timestamp(),
          snapshot.deviceCount(), snapshot.totalPorts(), snapshot.metadata().scanTarget());
    }
    CliPrinter.printf("Page %d of %d (%d snapshots)", page.page(), Math.max(1L, page.totalPages()), page.total());
  }

  void statistics(List<ScanStatistics> statistics) {
    if (json) {
      CliPrinter.println(codec.writePretty(statistics));
      return;
    }
    if (statistics.isEmpty()) {
      CliPrinter.println("No scan statistics yet.");
      return;
    }
    CliPrinter.printf("%-14s  %6s  %11s  %11s  %14s  %s", "SCAN TYPE", "SCANS", "AVG DEVICES", "MAX DEVICES",
        "AVG DURATION", "LAST SCAN");
    for (ScanStatistics row : statistics) {
      CliPrinter.printf("%-14s  %6d  %11.1f  %11d  %11.0f ms  %s", row.scanType(), row.scans(),
          row.averageDevices(), row.maxDevices(), row.averageScanDurationMillis(), row.lastScanAt());
    }
  }

  void diff(SnapshotDiff diff) {
    if (json) {
      CliPrinter.println(codec.writePretty(diff));
      return;
    }
    CliPrinter.println("Diff " + diff.fromSnapshot() + " -> " + diff.toSnapshot() + " at " + diff.timestamp());
    CliPrinter.println(" " + summaryLine(diff.summary()));
    for (DeviceDiff device : diff.deviceChanges()) {
      CliPrinter.println(" " + marker(device) + " " + device.deviceIp() + " [" + device.changeType() + "]");
      for (PortDiff port : device.portChanges()) {
        CliPrinter.println("     port " + port.port() + "/" + port.protocol() + " " + port.changeType()
            + " " + port.oldState() + " -> " + port.newState());
      }
      for (ServiceDiff service : device.serviceChanges()) {
        CliPrinter.println("     service on " + service.port() + "/" + service.protocol() + " "
            + service.changeType());
      }
      for (PropertyChange change : device.propertyChanges()) {
        CliPrinter.println("     " + change.property() + ": " + change.oldValue() + " -> " + change.newValue());
      }
    }
  }

  void health(HealthStatus health) {
    if (json) {
      CliPrinter.println(codec.writePretty(health));
      return;
    }
    CliPrinter.println("Health: " + health.status() + " at " + health.timestamp());
    for (ComponentHealth component : health.components()) {
      CliPrinter.printf(" %-14s %-5s %s", component.name(), component.healthy() ? "up" : "down",
          component.message() == null ? "" : component.message());
    }
  }

  void metrics(MonitoringMetrics metrics) {
    if (json) {
      CliPrinter.println(codec.writePretty(metrics));
      return;
    }
    CliPrinter.printLines(
        "Monitor totals",
        " Scans           : " + metrics.totalScans() + " (" + metrics.scansCompleted() + " completed, "
            + metrics.scanErrors() + " failed)",
        " Snapshots stored: " + metrics.snapshotsStored(),
        " Changes detected: " + metrics.changesDetected(),
        " Errors          : " + metrics.errorsEncountered(),
        " Last scan       : " + (metrics.lastScanTime() == null ? "never" : metrics.lastScanTime()));
  }

  static String summaryLine(DiffSummary summary) {
    return String.format(Locale.ROOT, "%d added, %d removed, %d changed, %d port changes, %d service changes "
            + "(%d total)", summary.devicesAdded(), summary.devicesRemoved(), summary.devicesChanged(),
        summary.portsChanged(), summary.servicesChanged(), summary.totalChanges());
  }

  private static String marker(DeviceDiff device) {
    if (device.changeType() == ChangeType.DEVICE_JOINED) {
      return "+";
    }
    return device.changeType() == ChangeType.DEVICE_LEFT ? "-" : "~";
  }
}
