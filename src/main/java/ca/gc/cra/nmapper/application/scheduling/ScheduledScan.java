package ca.gc.cra.nmapper.application.scheduling;

import ca.gc.cra.nmapper.domain.scan.ScanProfile;
import ca.gc.cra.nmapper.domain.scan.ScanTarget;
import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of a recurring scan registration.
 *
 * @param id job id
 * @param name display name
 * @param target scan target
 * @param profile scan profile
 * @param interval recurrence interval
 * @param timeout per-scan timeout
 * @param enabled whether periodic runs are dispatched
 * @param runCount completed runs (successful or terminally failed)
 * @param failureCount terminally failed runs
 * @param lastRun completion time of the last run; {@code null} before the first
 * @param nextRun next due time; {@code null} while disabled or running
 * @param createdAt registration time
 * @param updatedAt time of the last state change
 * @param lastError failure detail of the last failed run; {@code null} after a success
 * @since 0.1.0
 */
public record ScheduledScan(
    String id,
    String name,
    ScanTarget target,
    ScanProfile profile,
    Duration interval,
    Duration timeout,
    boolean enabled,
    long runCount,
    long failureCount,
    Instant lastRun,
    Instant nextRun,
    Instant createdAt,
    Instant updatedAt,
    String lastError) {}
