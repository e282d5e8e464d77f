package ca.gc.cra.nmapper.infrastructure.persistence.memory;

import static ca.gc.cra.nmapper.testing.Fixtures.device;
import static ca.gc.cra.nmapper.testing.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.nmapper.application.port.SnapshotStorePort;
import ca.gc.cra.nmapper.infrastructure.persistence.SnapshotStoreContract;
import org.junit.jupiter.api.Test;

class InMemorySnapshotStoreTest extends SnapshotStoreContract {

  @Override
  protected SnapshotStorePort newStore() {
    return new InMemorySnapshotStore();
  }

  @Test
  void contentSurvivesClose() {
    store.create(snapshot("s1", device("10.0.0.1")));
    store.close();
    store.initialize();

    assertEquals("s1", store.getLatest().orElseThrow().id());
  }
}
