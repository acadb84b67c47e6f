package org.empiresim.engine.resources.memory;

import com.typesafe.config.ConfigFactory;
import org.empiresim.runtime.offline.AutopilotStrategy;
import org.empiresim.runtime.offline.OfflineSnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class InMemoryOfflineSnapshotStoreTest {

    private final InMemoryOfflineSnapshotStore store = new InMemoryOfflineSnapshotStore("offline-snapshots", ConfigFactory.empty());

    @Test
    void consume_returnsSnapshotOnlyOnce() {
        OfflineSnapshot snapshot = new OfflineSnapshot("alice", 8, Instant.EPOCH, 42, null, AutopilotStrategy.GROWTH);
        store.save(snapshot);

        assertThat(store.peek("alice")).contains(snapshot);
        assertThat(store.consume("alice")).contains(snapshot);
        assertThat(store.consume("alice")).isEmpty();
        assertThat(store.getMetrics()).containsEntry("pending_snapshots", 0);
    }

    @Test
    void save_replacesPendingSnapshot() {
        store.save(new OfflineSnapshot("alice", 8, Instant.EPOCH, 42, null, null));
        OfflineSnapshot newer = new OfflineSnapshot("alice", 12, Instant.EPOCH, 40, 61.5, null);
        store.save(newer);

        assertThat(store.consume("alice")).contains(newer);
    }
}
