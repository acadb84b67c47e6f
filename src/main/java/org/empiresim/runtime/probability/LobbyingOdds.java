package org.empiresim.runtime.probability;

import com.typesafe.config.Config;
import org.empiresim.runtime.random.DeterministicRandom;

import java.util.Objects;

/**
 * Success probability of a lobbying action, resolved through the shared {@link ProbabilityResolver}
 * with the {@code lobbying} profile. The office level selects the difficulty tier.
 */
public final class LobbyingOdds {

    public static final String PROFILE = "lobbying";

    /** Political office levels, used as tier keys. */
    public enum OfficeLevel { LOCAL, STATE, FEDERAL }

    /**
     * One lobbying attempt.
     *
     * @param playerId           Acting player.
     * @param legislationId      Target legislation.
     * @param officeLevel        Office level of the target body.
     * @param donationAmount     Money spent on the action.
     * @param influence          Current influence score.
     * @param reputation         Reputation 0-100.
     * @param stateComposite     Alignment of the target state with the player, 0-1.
     * @param weeksUntilElection Weeks until the next election.
     * @param priorSuccessCount  Earlier successful lobbying actions.
     * @param economicCondition  Economic condition signal -1..1.
     */
    public record LobbyingAttempt(
        String playerId,
        String legislationId,
        OfficeLevel officeLevel,
        double donationAmount,
        double influence,
        double reputation,
        double stateComposite,
        double weeksUntilElection,
        int priorSuccessCount,
        double economicCondition
    ) {
        public LobbyingAttempt {
            Objects.requireNonNull(playerId, "playerId");
            Objects.requireNonNull(legislationId, "legislationId");
            Objects.requireNonNull(officeLevel, "officeLevel");
        }
    }

    private final ProbabilityResolver resolver;

    public LobbyingOdds(ProbabilityResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Builds the odds from the {@code empiresim.probability} block.
     */
    public static LobbyingOdds fromConfig(Config probabilityConfig) {
        return new LobbyingOdds(new ProbabilityResolver(ProbabilityConfig.fromConfig(probabilityConfig, PROFILE)));
    }

    public ProbabilityBreakdown calculate(LobbyingAttempt attempt) {
        return resolver.resolve(toInput(attempt));
    }

    /**
     * Resolves and rolls the attempt. The roll seed extends the jitter seed, so replaying the same
     * attempt always yields the same outcome.
     */
    public ResolvedOutcome resolve(LobbyingAttempt attempt) {
        return resolver.roll(toInput(attempt), DeterministicRandom.seedOf(jitterSeed(attempt), "roll"));
    }

    ProbabilityInput toInput(LobbyingAttempt attempt) {
        return ProbabilityInput.builder(attempt.officeLevel().name())
            .spend(attempt.donationAmount())
            .influence(attempt.influence())
            .reputation(attempt.reputation())
            .compositeWeight(attempt.stateComposite())
            .timeToEvent(attempt.weeksUntilElection())
            .priorSuccessCount(attempt.priorSuccessCount())
            .economicSignal(attempt.economicCondition())
            .seed(jitterSeed(attempt))
            .build();
    }

    private static String jitterSeed(LobbyingAttempt attempt) {
        return DeterministicRandom.seedOf(attempt.playerId(), "lobby", attempt.legislationId(), attempt.donationAmount());
    }
}
