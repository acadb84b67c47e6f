package org.empiresim.engine.players;

import org.empiresim.engine.api.players.PlayerTickState;
import org.empiresim.engine.api.resources.database.IPlayerTickStateStore;
import org.empiresim.engine.api.ticks.ClosedTickWriteException;
import org.empiresim.engine.api.ticks.ConcurrentTickException;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks which global tick each player has been processed up to, so that processors only handle
 * lagging players and replays of a tick stay idempotent.
 * <p>
 * Writes made through {@link #callInTick} are fenced: they land only while their tick is the open one.
 * {@link #closeTick} waits for in-flight fenced writes, so after it returns no worker of that tick can
 * move a player ahead again. Unbound calls of {@link #markProcessed} are not fenced.
 */
public class PlayerTickStateTracker {

    private static final Logger log = LoggerFactory.getLogger(PlayerTickStateTracker.class);

    private final IPlayerTickStateStore store;
    private final Clock clock;
    private final ReentrantReadWriteLock fence = new ReentrantReadWriteLock();
    private final ThreadLocal<String> boundTickId = new ThreadLocal<>();
    private volatile String openTickId;

    public PlayerTickStateTracker(IPlayerTickStateStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the player's state, creating the initial one ({@link GameTime#ZERO}) on first access.
     */
    public PlayerTickState getOrCreate(String playerId) {
        return store.getOrCreate(requirePlayerId(playerId), now());
    }

    /**
     * Marks a subsystem as processed for the player at the given game time.
     * Calling it again for the same or an older game time has no effect.
     */
    public PlayerTickState markProcessed(String playerId, GameTime gameTime, String system) {
        return markProcessed(playerId, gameTime, system, Map.of());
    }

    /**
     * Marks a subsystem as processed and adds counter increments if the subsystem advanced.
     *
     * @param playerId          The player.
     * @param gameTime          The processed game time, must not be {@link GameTime#ZERO}.
     * @param system            Subsystem (processor) name.
     * @param counterIncrements Counter increments, applied at most once per game time.
     * @return The state after the update.
     */
    public PlayerTickState markProcessed(String playerId, GameTime gameTime, String system,
                                         Map<String, Long> counterIncrements) {
        requirePlayerId(playerId);
        Objects.requireNonNull(gameTime, "gameTime");
        if (gameTime.isZero()) {
            throw new ValidationException("Cannot mark player '" + playerId + "' as processed at GameTime.ZERO");
        }
        if (system == null || system.isBlank()) {
            throw new ValidationException("system must not be blank");
        }
        Map<String, Long> increments = counterIncrements == null ? Map.of() : counterIncrements;
        String bound = boundTickId.get();
        if (bound == null) {
            return store.advance(playerId, gameTime, system, increments, now());
        }
        fence.readLock().lock();
        try {
            if (!bound.equals(openTickId)) {
                throw new ClosedTickWriteException(bound, String.format(
                    "Discarded '%s' progress of player '%s' at %s: tick '%s' is closed", system, playerId, gameTime, bound));
            }
            return store.advance(playerId, gameTime, system, increments, now());
        } finally {
            fence.readLock().unlock();
        }
    }

    // ========== Write fence ==========

    /**
     * Opens the write fence for a tick.
     *
     * @throws ConcurrentTickException if the fence of another tick is still open.
     */
    public void openTick(String tickId) {
        Objects.requireNonNull(tickId, "tickId");
        fence.writeLock().lock();
        try {
            if (openTickId != null && !openTickId.equals(tickId)) {
                throw new ConcurrentTickException(String.format(
                    "Cannot open tick '%s': tick '%s' still accepts writes", tickId, openTickId));
            }
            openTickId = tickId;
        } finally {
            fence.writeLock().unlock();
        }
    }

    /**
     * Closes the write fence if it belongs to {@code tickId}. Blocks until fenced writes in flight
     * have finished.
     *
     * @return {@code true} if the fence was open for this tick.
     */
    public boolean closeTick(String tickId) {
        fence.writeLock().lock();
        try {
            if (tickId == null || !tickId.equals(openTickId)) {
                return false;
            }
            openTickId = null;
            log.debug("Write fence of tick '{}' closed", tickId);
            return true;
        } finally {
            fence.writeLock().unlock();
        }
    }

    /**
     * Runs {@code work} with this thread's writes bound to {@code tickId}.
     */
    public <T> T callInTick(String tickId, Callable<T> work) throws Exception {
        Objects.requireNonNull(tickId, "tickId");
        String previous = boundTickId.get();
        boundTickId.set(tickId);
        try {
            return work.call();
        } finally {
            if (previous == null) {
                boundTickId.remove();
            } else {
                boundTickId.set(previous);
            }
        }
    }

    public boolean isTickOpen(String tickId) {
        return tickId != null && tickId.equals(openTickId);
    }

    public boolean hasProcessed(String playerId, String system, GameTime gameTime) {
        return store.find(playerId).map(state -> state.hasProcessed(system, gameTime)).orElse(false);
    }

    /**
     * @return Ids of known players whose last processed tick lies before {@code gameTime}, ordered by id.
     */
    public List<String> getUnprocessedPlayers(GameTime gameTime) {
        return store.findLagging(Objects.requireNonNull(gameTime, "gameTime"));
    }

    /**
     * Unknown players count as lagging: they have never been processed.
     */
    public boolean isLagging(String playerId, GameTime gameTime) {
        return store.find(playerId).map(state -> state.isLagging(gameTime)).orElse(true);
    }

    /**
     * Moves players that ran ahead of the last completed tick back to it. Called after a tick failed,
     * so that the next tick at the same game time picks these players up again.
     *
     * @param lastCompleted Game time of the latest completed tick.
     * @return Number of players moved back.
     */
    public int reconcileAfterFailure(GameTime lastCompleted) {
        int changed = store.clampAhead(Objects.requireNonNull(lastCompleted, "lastCompleted"), now());
        if (changed > 0) {
            log.info("Reconciled {} player(s) back to {} after failed tick", changed, lastCompleted);
        }
        return changed;
    }

    public long countPlayers() {
        return store.count();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String requirePlayerId(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new ValidationException("playerId must not be blank");
        }
        return playerId;
    }
}
