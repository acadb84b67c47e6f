package org.empiresim.engine.processors;

import com.typesafe.config.Config;
import org.empiresim.engine.api.players.SystemState;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.offline.OfflineAdjustment;
import org.empiresim.runtime.offline.OfflineProtection;
import org.empiresim.runtime.offline.OfflineSnapshot;
import org.empiresim.runtime.probability.LobbyingOdds;
import org.empiresim.runtime.probability.LobbyingOdds.LobbyingAttempt;
import org.empiresim.runtime.probability.LobbyingOdds.OfficeLevel;
import org.empiresim.runtime.probability.ResolvedOutcome;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Monthly lobbying of every player. The player's influence pool decays by {@code decayRate} and one
 * action on the standing agenda is rolled through the shared {@link LobbyingOdds}; a success adds
 * {@code successInfluence}. The roll is seeded by player, agenda and month, so replays agree.
 * <p>
 * While a player has a pending offline snapshot, the influence lost since logout is limited by
 * {@link OfflineProtection} and gains are scaled by the snapshot's autopilot efficiency. Protection
 * only cancels decay, it never creates influence.
 * <p>
 * Influence is kept as the {@value #INFLUENCE} counter, relative to {@code startingInfluence}.
 */
public class LobbyingProcessor extends AbstractTickProcessor {

    public static final String INFLUENCE = "influence";
    public static final String SUCCESSES = "lobbyingSuccesses";
    public static final String INFLUENCE_PROTECTED = "influenceProtected";

    private final OfficeLevel office;
    private final String agenda;
    private final double monthlyDonation;
    private final double reputation;
    private final double stateComposite;
    private final double weeksUntilElection;
    private final long startingInfluence;
    private final double decayRate;
    private final long successInfluence;

    public LobbyingProcessor(String name, Config options, ProcessorContext context) {
        super(name, options, context);
        this.office = options.hasPath("office") ? options.getEnum(OfficeLevel.class, "office") : OfficeLevel.STATE;
        this.agenda = options.hasPath("agenda") ? options.getString("agenda") : "standing-agenda";
        this.monthlyDonation = options.hasPath("monthlyDonation") ? options.getDouble("monthlyDonation") : 1000.0;
        this.reputation = options.hasPath("reputation") ? options.getDouble("reputation") : 50.0;
        this.stateComposite = options.hasPath("stateComposite") ? options.getDouble("stateComposite") : 0.5;
        this.weeksUntilElection = options.hasPath("weeksUntilElection") ? options.getDouble("weeksUntilElection") : 12.0;
        this.startingInfluence = options.hasPath("startingInfluence") ? options.getLong("startingInfluence") : 100L;
        this.decayRate = options.hasPath("decayRate") ? options.getDouble("decayRate") : 0.05;
        this.successInfluence = options.hasPath("successInfluence") ? options.getLong("successInfluence") : 10L;
        if (decayRate < 0.0 || decayRate > 1.0) {
            throw new IllegalArgumentException("decayRate must lie in [0, 1] but was " + decayRate);
        }
        if (successInfluence < 0) {
            throw new IllegalArgumentException("successInfluence must not be negative but was " + successInfluence);
        }
    }

    @Override
    protected int defaultPriority() {
        return 50;
    }

    @Override
    protected Map<String, Long> processPlayer(String playerId, GameTime gameTime) {
        Map<String, Long> counters = context.tracker().getOrCreate(playerId).system(name)
            .map(SystemState::counters)
            .orElse(Map.of());
        long influence = startingInfluence + counters.getOrDefault(INFLUENCE, 0L);
        long priorSuccesses = counters.getOrDefault(SUCCESSES, 0L);

        LobbyingAttempt attempt = new LobbyingAttempt(playerId, agenda + "@" + gameTime.totalMonths(), office,
            monthlyDonation, Math.max(0L, influence), reputation, stateComposite, weeksUntilElection,
            (int) Math.min(priorSuccesses, Integer.MAX_VALUE), 0.0);
        ResolvedOutcome outcome = context.lobbyingOdds().resolve(attempt);

        long decay = Math.round(Math.max(0L, influence) * decayRate);
        long gain = outcome.success() ? successInfluence : 0L;
        long delta = gain - decay;
        long protectedInfluence = 0L;

        Optional<OfflineSnapshot> snapshot = context.offlineSnapshots().peek(playerId);
        if (snapshot.isPresent() && context.weekOf(gameTime) >= snapshot.get().capturedAtWeek()) {
            long adjusted = protectOffline(snapshot.get(), gameTime, influence, gain, decay);
            protectedInfluence = adjusted - delta;
            delta = adjusted;
        }

        Map<String, Long> increments = new LinkedHashMap<>();
        increments.put(INFLUENCE, delta);
        increments.put(SUCCESSES, outcome.success() ? 1L : 0L);
        if (protectedInfluence != 0L) {
            increments.put(INFLUENCE_PROTECTED, protectedInfluence);
            log.debug("Offline protection kept {} influence for '{}' at {}", protectedInfluence, playerId, gameTime);
        }
        return increments;
    }

    /**
     * @return The influence change of an offline player, between the raw change and the gain.
     */
    private long protectOffline(OfflineSnapshot snapshot, GameTime gameTime, long influence, long gain, long decay) {
        double scaledGain = gain * snapshot.autopilotStrategy().profile().resourceEfficiencyMultiplier();
        double driftSinceLogout = influence + scaledGain - decay - snapshot.influence();
        OfflineAdjustment adjustment = OfflineProtection.computeOfflineAdjustment(
            snapshot, context.weekOf(gameTime), driftSinceLogout, context.offlineClamp());
        long raw = Math.round(scaledGain) - decay;
        long clamped = Math.round(snapshot.influence() + adjustment.adjustedDelta()) - influence;
        return Math.min(Math.round(scaledGain), Math.max(raw, clamped));
    }
}
