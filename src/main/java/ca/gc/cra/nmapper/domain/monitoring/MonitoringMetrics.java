package ca.gc.cra.nmapper.domain.monitoring;

import java.time.Instant;

/**
 * Point-in-time view of the orchestrator's running counters.
 *
 * @param uptimeMillis time since the orchestrator last reached {@code RUNNING}; zero when not running
 * @param totalScans scans attempted (completed plus failed)
 * @param scansCompleted scans that produced a snapshot
 * @param scanErrors scans that failed after all retries
 * @param totalDevices device count of the latest snapshot
 * @param devicesDiscovered devices that joined across all processed diffs
 * @param changesDetected sum of {@code totalChanges} across all processed diffs
 * @param snapshotsStored snapshots persisted by this instance
 * @param errorsEncountered pipeline and health-check errors
 * @param activeSchedules enabled recurring schedules
 * @param lastScanTime completion time of the last scan; {@code null} before the first one
 * @param averageScanDurationMillis mean scan duration of completed scans
 * @since 0.1.0
 */
public record MonitoringMetrics(
    long uptimeMillis,
    long totalScans,
    long scansCompleted,
    long scanErrors,
    int totalDevices,
    long devicesDiscovered,
    long changesDetected,
    long snapshotsStored,
    long errorsEncountered,
    int activeSchedules,
    Instant lastScanTime,
    long averageScanDurationMillis) {}
