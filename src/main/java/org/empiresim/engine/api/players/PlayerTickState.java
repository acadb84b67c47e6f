package org.empiresim.engine.api.players;

import org.empiresim.runtime.model.GameTime;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-player record of the last globally processed tick.
 * <p>
 * A player is "caught up" when {@code lastProcessedTick} equals the current game time and "lagging"
 * otherwise. {@code lastProcessedTick} never moves backward except through reconciliation after a
 * failed tick.
 *
 * @param playerId          The player.
 * @param lastProcessedTick Last game time any subsystem processed, {@link GameTime#ZERO} if never.
 * @param lastProcessedAt   Wall-clock time of the last change.
 * @param systems           Subsystem progress keyed by processor name.
 */
public record PlayerTickState(
    String playerId,
    GameTime lastProcessedTick,
    Instant lastProcessedAt,
    Map<String, SystemState> systems
) {

    public PlayerTickState {
        Objects.requireNonNull(playerId, "playerId");
        lastProcessedTick = lastProcessedTick == null ? GameTime.ZERO : lastProcessedTick;
        systems = systems == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(systems));
    }

    public static PlayerTickState initial(String playerId, Instant now) {
        return new PlayerTickState(playerId, GameTime.ZERO, now, Map.of());
    }

    public Optional<SystemState> system(String system) {
        return Optional.ofNullable(systems.get(system));
    }

    public boolean isLagging(GameTime gameTime) {
        return lastProcessedTick.isBefore(gameTime);
    }

    /**
     * Returns {@code true} if the named subsystem already applied {@code gameTime} or later.
     */
    public boolean hasProcessed(String system, GameTime gameTime) {
        return system(system).map(s -> !s.lastProcessed().isBefore(gameTime)).orElse(false);
    }

    /**
     * Applies an ordering-guarded advance. Counters change only if the subsystem actually advances.
     */
    public PlayerTickState advancedTo(GameTime gameTime, String system, Map<String, Long> increments, Instant at) {
        SystemState current = systems.getOrDefault(system, new SystemState(GameTime.ZERO, null, Map.of()));
        SystemState next = current.advancedTo(gameTime, at, increments);
        boolean tickAdvanced = gameTime.isAfter(lastProcessedTick);
        if (next == current && !tickAdvanced) {
            return this;
        }
        Map<String, SystemState> updated = new LinkedHashMap<>(systems);
        updated.put(system, next);
        return new PlayerTickState(playerId, tickAdvanced ? gameTime : lastProcessedTick, at, updated);
    }

    /**
     * Returns a copy whose {@code lastProcessedTick} does not exceed {@code ceiling}.
     * Subsystem progress is kept so that replaying a tick stays idempotent.
     */
    public PlayerTickState clampedTo(GameTime ceiling, Instant at) {
        if (!lastProcessedTick.isAfter(ceiling)) {
            return this;
        }
        return new PlayerTickState(playerId, ceiling, at, systems);
    }
}
