package ca.gc.cra.nmapper.application.scheduling;

import java.time.Instant;

/**
 * History entry for one scan invocation (all of its attempts).
 *
 * @param jobId job id
 * @param kind run kind
 * @param target scanned range
 * @param startedAt start of the first attempt
 * @param finishedAt end of the last attempt
 * @param attempts attempts made
 * @param status outcome
 * @param deviceCount devices found; zero unless {@link Status#SUCCEEDED}
 * @param error failure detail, truncated; {@code null} on success
 * @since 0.1.0
 */
public record ScanExecution(
    String jobId,
    RunKind kind,
    String target,
    Instant startedAt,
    Instant finishedAt,
    int attempts,
    Status status,
    int deviceCount,
    String error) {

  /**
   * Duration of the invocation in milliseconds.
   *
   * @return elapsed milliseconds
   */
  public long durationMillis() {
    return Math.max(0L, finishedAt.toEpochMilli() - startedAt.toEpochMilli());
  }

  /** Invocation outcomes. */
  public enum Status {
    SUCCEEDED,
    FAILED,
    CANCELLED
  }
}
