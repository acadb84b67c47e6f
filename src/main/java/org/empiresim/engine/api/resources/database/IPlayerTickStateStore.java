package org.empiresim.engine.api.resources.database;

import org.empiresim.engine.api.players.PlayerTickState;
import org.empiresim.engine.api.resources.IResource;
import org.empiresim.runtime.model.GameTime;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of per-player tick state. Every mutation is atomic per player, so concurrent catch-up
 * workers never lose updates.
 */
public interface IPlayerTickStateStore extends IResource {

    Optional<PlayerTickState> find(String playerId);

    /**
     * Returns the existing state or atomically creates the initial one.
     */
    PlayerTickState getOrCreate(String playerId, Instant now);

    /**
     * Advances a player's subsystem with an ordering guard. Creates the player if absent.
     * Neither the player's tick nor the subsystem ever moves backward; counters are only added when
     * the subsystem advances.
     *
     * @param playerId          The player.
     * @param gameTime          The processed game time.
     * @param system            Subsystem (processor) name.
     * @param counterIncrements Counter increments, may be empty.
     * @param at                Wall-clock time of the update.
     * @return The state after the update.
     */
    PlayerTickState advance(String playerId, GameTime gameTime, String system,
                            Map<String, Long> counterIncrements, Instant at);

    /**
     * @return Ids of players with {@code lastProcessedTick < gameTime}, ordered by id.
     */
    List<String> findLagging(GameTime gameTime);

    /**
     * Moves every player that is ahead of {@code ceiling} back to it.
     *
     * @return Number of players changed.
     */
    int clampAhead(GameTime ceiling, Instant at);

    long count();
}
