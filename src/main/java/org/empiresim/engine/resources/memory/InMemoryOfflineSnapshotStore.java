package org.empiresim.engine.resources.memory;

import com.typesafe.config.Config;
import org.empiresim.engine.api.resources.database.IOfflineSnapshotStore;
import org.empiresim.engine.resources.AbstractResource;
import org.empiresim.runtime.offline.OfflineSnapshot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Offline snapshot store kept on the heap.
 */
public class InMemoryOfflineSnapshotStore extends AbstractResource implements IOfflineSnapshotStore {

    private final ConcurrentHashMap<String, OfflineSnapshot> snapshots = new ConcurrentHashMap<>();

    public InMemoryOfflineSnapshotStore(String name, Config options) {
        super(name, options);
    }

    @Override
    public void save(OfflineSnapshot snapshot) {
        snapshots.put(snapshot.playerId(), snapshot);
    }

    @Override
    public Optional<OfflineSnapshot> consume(String playerId) {
        return Optional.ofNullable(snapshots.remove(playerId));
    }

    @Override
    public Optional<OfflineSnapshot> peek(String playerId) {
        return Optional.ofNullable(snapshots.get(playerId));
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("pending_snapshots", snapshots.size());
    }
}
