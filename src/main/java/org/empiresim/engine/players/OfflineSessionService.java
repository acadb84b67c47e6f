package org.empiresim.engine.players;

import org.empiresim.engine.api.processors.ProcessorResult;
import org.empiresim.engine.api.resources.database.IOfflineSnapshotStore;
import org.empiresim.engine.scheduler.TickScheduler;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.model.ValidationException;
import org.empiresim.runtime.offline.AutopilotStrategy;
import org.empiresim.runtime.offline.ClampConfig;
import org.empiresim.runtime.offline.OfflineAdjustment;
import org.empiresim.runtime.offline.OfflineProtection;
import org.empiresim.runtime.offline.OfflineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Connects player sessions to the offline protection engine.
 * <p>
 * A snapshot is captured when a session ends. On the next login it is consumed exactly once, the
 * offline adjustment is computed from it and the player is caught up to the current game time.
 */
public class OfflineSessionService {

    private static final Logger log = LoggerFactory.getLogger(OfflineSessionService.class);

    private final IOfflineSnapshotStore snapshots;
    private final TickScheduler scheduler;
    private final ClampConfig clampConfig;
    private final int weeksPerMonth;
    private final Clock clock;

    /**
     * Outcome of a login.
     *
     * @param playerId   The player.
     * @param adjustment Offline adjustment, {@code null} if no snapshot was pending.
     * @param catchUp    Results of the catch-up processing, empty if the player was not lagging.
     */
    public record LoginOutcome(String playerId, OfflineAdjustment adjustment, List<ProcessorResult> catchUp) {
        public LoginOutcome {
            catchUp = catchUp == null ? List.of() : List.copyOf(catchUp);
        }

        public Optional<OfflineAdjustment> offlineAdjustment() {
            return Optional.ofNullable(adjustment);
        }
    }

    public OfflineSessionService(IOfflineSnapshotStore snapshots, TickScheduler scheduler, ClampConfig clampConfig,
                                 int weeksPerMonth, Clock clock) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clampConfig = Objects.requireNonNull(clampConfig, "clampConfig");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (weeksPerMonth < 1) {
            throw new IllegalArgumentException("weeksPerMonth must be positive but was " + weeksPerMonth);
        }
        this.weeksPerMonth = weeksPerMonth;
    }

    /**
     * Captures the player's state at session end, replacing an unconsumed earlier snapshot.
     *
     * @param playerId       The player.
     * @param influence      Influence at logout.
     * @param approvalRating Approval rating, {@code null} if the player holds no office.
     * @param strategy       Autopilot strategy for the absence, {@code null} for BALANCED.
     * @return The stored snapshot.
     */
    public OfflineSnapshot onSessionEnd(String playerId, double influence, Double approvalRating,
                                        AutopilotStrategy strategy) {
        if (playerId == null || playerId.isBlank()) {
            throw new ValidationException("playerId must not be blank");
        }
        if (!Double.isFinite(influence)) {
            throw new ValidationException("influence must be a finite number but was " + influence);
        }
        OfflineSnapshot snapshot = new OfflineSnapshot(playerId, currentWeek(),
            clock.instant().truncatedTo(ChronoUnit.MILLIS), influence, approvalRating, strategy);
        snapshots.save(snapshot);
        log.debug("Captured offline snapshot of '{}' at week {} ({})",
            playerId, snapshot.capturedAtWeek(), snapshot.autopilotStrategy());
        return snapshot;
    }

    /**
     * Handles a returning player.
     *
     * @param playerId The player.
     * @param rawDelta Raw state change accumulated while offline, before protection.
     * @return The adjustment (if a snapshot was pending) and the catch-up results.
     */
    public LoginOutcome onLogin(String playerId, double rawDelta) {
        if (playerId == null || playerId.isBlank()) {
            throw new ValidationException("playerId must not be blank");
        }
        OfflineAdjustment adjustment = null;
        Optional<OfflineSnapshot> snapshot = snapshots.consume(playerId);
        if (snapshot.isPresent()) {
            try {
                adjustment = OfflineProtection.computeOfflineAdjustment(snapshot.get(), currentWeek(), rawDelta, clampConfig);
                log.info("Player '{}' returned after {} week(s) offline: delta {} -> {}, catch-up buff {}",
                    playerId, adjustment.weeksOffline(), rawDelta, adjustment.adjustedDelta(),
                    String.format("%.3f", adjustment.catchUpBuff()));
            } catch (ValidationException e) {
                log.warn("Discarded offline snapshot of '{}': {}", playerId, e.getMessage());
            }
        }
        List<ProcessorResult> catchUp = scheduler.catchUpPlayer(playerId);
        return new LoginOutcome(playerId, adjustment, catchUp);
    }

    /**
     * @return Week index of the current game time.
     */
    public long currentWeek() {
        return weekOf(scheduler.getCurrentGameTime());
    }

    public long weekOf(GameTime gameTime) {
        return (long) gameTime.totalMonths() * weeksPerMonth;
    }

    public ClampConfig getClampConfig() {
        return clampConfig;
    }
}
