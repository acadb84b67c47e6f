package org.empiresim.engine.api.players;

import org.empiresim.runtime.model.GameTime;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Progress of one subsystem (processor) for one player.
 *
 * @param lastProcessed   Last game time the subsystem applied its effects.
 * @param lastProcessedAt Wall-clock time of that application.
 * @param counters        Cumulative subsystem counters.
 */
public record SystemState(GameTime lastProcessed, Instant lastProcessedAt, Map<String, Long> counters) {

    public SystemState {
        lastProcessed = lastProcessed == null ? GameTime.ZERO : lastProcessed;
        counters = counters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    /**
     * Returns the state after applying a tick, or this state if {@code gameTime} is not newer.
     */
    public SystemState advancedTo(GameTime gameTime, Instant at, Map<String, Long> increments) {
        if (!gameTime.isAfter(lastProcessed)) {
            return this;
        }
        Map<String, Long> merged = new LinkedHashMap<>(counters);
        if (increments != null) {
            increments.forEach((key, value) -> merged.merge(key, value, Long::sum));
        }
        return new SystemState(gameTime, at, merged);
    }
}
