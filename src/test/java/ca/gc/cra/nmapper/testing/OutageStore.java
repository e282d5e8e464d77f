package ca.gc.cra.nmapper.testing;

import ca.gc.cra.nmapper.application.port.Page;
import ca.gc.cra.nmapper.application.port.PageRequest;
import ca.gc.cra.nmapper.application.port.ScanStatistics;
import ca.gc.cra.nmapper.application.port.SnapshotQuery;
import ca.gc.cra.nmapper.application.port.SnapshotStorePort;
import ca.gc.cra.nmapper.domain.error.InfrastructureException;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.infrastructure.persistence.memory.InMemorySnapshotStore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory store that fails with a retryable infrastructure error while an outage is active. The outage is
 * either permanent or limited to a number of calls.
 */
public final class OutageStore implements SnapshotStorePort {
  private final InMemorySnapshotStore delegate = new InMemorySnapshotStore();
  private final AtomicInteger failuresLeft = new AtomicInteger();
  private final AtomicInteger calls = new AtomicInteger();
  private final AtomicInteger initializeCalls = new AtomicInteger();
  private final AtomicInteger pings = new AtomicInteger();
  private volatile boolean down;
  private volatile CountDownLatch initializeGate;

  public OutageStore down(boolean value) {
    this.down = value;
    return this;
  }

  public OutageStore failNext(int count) {
    failuresLeft.set(count);
    return this;
  }

  public int calls() {
    return calls.get();
  }

  /** Makes {@link #initialize()} wait until the latch opens. */
  public OutageStore holdInitializeUntil(CountDownLatch latch) {
    this.initializeGate = latch;
    return this;
  }

  public int initializeCalls() {
    return initializeCalls.get();
  }

  public int pings() {
    return pings.get();
  }

  public InMemorySnapshotStore delegate() {
    return delegate;
  }

  @Override
  public void initialize() {
    initializeCalls.incrementAndGet();
    CountDownLatch gate = initializeGate;
    if (gate != null) {
      try {
        if (!gate.await(10, TimeUnit.SECONDS)) {
          throw new IllegalStateException("initialize gate never opened");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("interrupted while initializing", ex);
      }
    }
    check();
    delegate.initialize();
  }

  @Override
  public String create(NetworkSnapshot snapshot) {
    check();
    return delegate.create(snapshot);
  }

  @Override
  public NetworkSnapshot getById(String id) {
    check();
    return delegate.getById(id);
  }

  @Override
  public Optional<NetworkSnapshot> getLatest() {
    check();
    return delegate.getLatest();
  }

  @Override
  public Page<NetworkSnapshot> list(SnapshotQuery query, PageRequest page) {
    check();
    return delegate.list(query, page);
  }

  @Override
  public String createDiff(SnapshotDiff diff) {
    check();
    return delegate.createDiff(diff);
  }

  @Override
  public Optional<SnapshotDiff> getDiff(String fromId, String toId) {
    check();
    return delegate.getDiff(fromId, toId);
  }

  @Override
  public List<SnapshotDiff> listRecentDiffs(Instant since) {
    check();
    return delegate.listRecentDiffs(since);
  }

  @Override
  public void delete(String id) {
    check();
    delegate.delete(id);
  }

  @Override
  public int deleteOlderThan(Instant cutoff) {
    check();
    return delegate.deleteOlderThan(cutoff);
  }

  @Override
  public List<ScanStatistics> statistics() {
    check();
    return delegate.statistics();
  }

  @Override
  public void ping() {
    pings.incrementAndGet();
    check();
  }

  @Override
  public void close() {
    delegate.close();
  }

  private void check() {
    calls.incrementAndGet();
    if (down || failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new InfrastructureException("connection refused", null);
    }
  }
}
