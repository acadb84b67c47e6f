package org.empiresim.engine.api.resources.database;

import org.empiresim.engine.api.resources.IResource;
import org.empiresim.runtime.offline.OfflineSnapshot;

import java.util.Optional;

/**
 * Persistence of offline snapshots. At most one snapshot exists per player.
 */
public interface IOfflineSnapshotStore extends IResource {

    /**
     * Stores the snapshot, replacing an unconsumed one of the same player.
     */
    void save(OfflineSnapshot snapshot);

    /**
     * Atomically removes and returns the player's snapshot. A second call returns empty.
     */
    Optional<OfflineSnapshot> consume(String playerId);

    Optional<OfflineSnapshot> peek(String playerId);
}
