package org.empiresim.engine.processors;

import org.empiresim.engine.api.resources.database.IOfflineSnapshotStore;
import org.empiresim.engine.players.PlayerTickStateTracker;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.offline.ClampConfig;
import org.empiresim.runtime.probability.LobbyingOdds;

import java.util.Objects;

/**
 * Shared collaborators handed to every configured tick processor.
 *
 * @param tracker          Per-player tick state.
 * @param lobbyingOdds     Odds of lobbying actions.
 * @param offlineSnapshots Pending snapshots of players who are offline.
 * @param offlineClamp     Offline protection tuning for deltas of absent players.
 * @param weeksPerMonth    Game weeks per game month.
 */
public record ProcessorContext(
    PlayerTickStateTracker tracker,
    LobbyingOdds lobbyingOdds,
    IOfflineSnapshotStore offlineSnapshots,
    ClampConfig offlineClamp,
    int weeksPerMonth
) {
    public ProcessorContext {
        Objects.requireNonNull(tracker, "tracker");
        Objects.requireNonNull(lobbyingOdds, "lobbyingOdds");
        Objects.requireNonNull(offlineSnapshots, "offlineSnapshots");
        Objects.requireNonNull(offlineClamp, "offlineClamp");
        if (weeksPerMonth < 1) {
            throw new IllegalArgumentException("weeksPerMonth must be positive but was " + weeksPerMonth);
        }
    }

    /**
     * @return Week index of {@code gameTime}, on the same scale as {@code OfflineSnapshot.capturedAtWeek}.
     */
    public long weekOf(GameTime gameTime) {
        return (long) gameTime.totalMonths() * weeksPerMonth;
    }
}
