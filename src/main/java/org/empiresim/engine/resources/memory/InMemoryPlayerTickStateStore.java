package org.empiresim.engine.resources.memory;

import com.typesafe.config.Config;
import org.empiresim.engine.api.players.PlayerTickState;
import org.empiresim.engine.api.resources.database.IPlayerTickStateStore;
import org.empiresim.engine.resources.AbstractResource;
import org.empiresim.runtime.model.GameTime;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Player tick state store kept on the heap. Per-player atomicity comes from
 * {@link ConcurrentHashMap#compute}, which serializes updates of the same key.
 */
public class InMemoryPlayerTickStateStore extends AbstractResource implements IPlayerTickStateStore {

    private final ConcurrentHashMap<String, PlayerTickState> states = new ConcurrentHashMap<>();

    public InMemoryPlayerTickStateStore(String name, Config options) {
        super(name, options);
    }

    @Override
    public Optional<PlayerTickState> find(String playerId) {
        return Optional.ofNullable(states.get(playerId));
    }

    @Override
    public PlayerTickState getOrCreate(String playerId, Instant now) {
        return states.computeIfAbsent(playerId, id -> PlayerTickState.initial(id, now));
    }

    @Override
    public PlayerTickState advance(String playerId, GameTime gameTime, String system,
                                   Map<String, Long> counterIncrements, Instant at) {
        return states.compute(playerId, (id, current) -> {
            PlayerTickState base = current != null ? current : PlayerTickState.initial(id, at);
            return base.advancedTo(gameTime, system, counterIncrements, at);
        });
    }

    @Override
    public List<String> findLagging(GameTime gameTime) {
        return states.values().stream()
            .filter(state -> state.isLagging(gameTime))
            .map(PlayerTickState::playerId)
            .sorted()
            .toList();
    }

    @Override
    public int clampAhead(GameTime ceiling, Instant at) {
        AtomicInteger changed = new AtomicInteger();
        for (String playerId : states.keySet()) {
            states.computeIfPresent(playerId, (id, current) -> {
                PlayerTickState clamped = current.clampedTo(ceiling, at);
                if (clamped != current) {
                    changed.incrementAndGet();
                }
                return clamped;
            });
        }
        return changed.get();
    }

    @Override
    public long count() {
        return states.size();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("players", states.size());
    }
}
