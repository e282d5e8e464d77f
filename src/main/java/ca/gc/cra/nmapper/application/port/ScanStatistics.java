package ca.gc.cra.nmapper.application.port;

import java.time.Instant;

/**
 * Aggregates over stored snapshots of one scan type.
 *
 * @param scanType scan profile label
 * @param scans number of stored snapshots
 * @param averageDevices mean device count
 * @param maxDevices largest device count
 * @param averageScanDurationMillis mean scan duration
 * @param lastScanAt timestamp of the newest snapshot
 * @since 0.1.0
 */
public record ScanStatistics(
    String scanType,
    long scans,
    double averageDevices,
    int maxDevices,
    double averageScanDurationMillis,
    Instant lastScanAt) {}
