package ca.gc.cra.nmapper.application.scheduling;

import java.time.Instant;

/**
 * Scheduler counters and gauges.
 *
 * @param totalSchedules registered recurring schedules
 * @param activeSchedules enabled recurring schedules
 * @param completedRuns invocations that produced a snapshot
 * @param failedRuns invocations that failed after all retries
 * @param averageDurationMillis mean duration of completed invocations
 * @param nextScheduledRun earliest due time of an enabled schedule; {@code null} when none
 * @param lastCompletedRun finish time of the last successful invocation; {@code null} when none
 * @param runningScans scans executing now
 * @param queuedJobs runs waiting for their due time or a free slot
 * @since 0.1.0
 */
public record SchedulerMetrics(
    int totalSchedules,
    int activeSchedules,
    long completedRuns,
    long failedRuns,
    long averageDurationMillis,
    Instant nextScheduledRun,
    Instant lastCompletedRun,
    int runningScans,
    int queuedJobs) {}
