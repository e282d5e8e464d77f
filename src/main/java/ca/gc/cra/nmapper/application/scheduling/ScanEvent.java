package ca.gc.cra.nmapper.application.scheduling;

import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Typed events published by {@link ScanJobScheduler} on its event channel.
 *
 * @since 0.1.0
 */
public sealed interface ScanEvent permits ScanEvent.Completed, ScanEvent.Failed {

  /**
   * Scheduler job id the event belongs to.
   *
   * @return job id
   */
  String jobId();

  /**
   * A scan produced a snapshot.
   *
   * @param jobId job id
   * @param kind run kind
   * @param snapshot produced snapshot (not yet persisted)
   * @param attempts attempts used, including the successful one
   * @param handled completed by the consumer once the snapshot has been processed
   */
  record Completed(
      String jobId, RunKind kind, NetworkSnapshot snapshot, int attempts, CompletableFuture<Void> handled)
      implements ScanEvent {
    public Completed {
      Objects.requireNonNull(jobId, "jobId");
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(snapshot, "snapshot");
      Objects.requireNonNull(handled, "handled");
    }
  }

  /**
   * A scan failed and will not be retried again for this invocation.
   *
   * @param jobId job id
   * @param kind run kind
   * @param target scanned range
   * @param attempts attempts made
   * @param message failure detail
   */
  record Failed(String jobId, RunKind kind, String target, int attempts, String message) implements ScanEvent {
    public Failed {
      Objects.requireNonNull(jobId, "jobId");
      Objects.requireNonNull(kind, "kind");
    }
  }
}
