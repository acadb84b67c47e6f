package org.empiresim.runtime.probability;

import org.apache.commons.math3.util.FastMath;
import org.empiresim.runtime.model.ValidationException;
import org.empiresim.runtime.random.DeterministicRandom;

import java.util.Objects;

/**
 * Turns a bundle of game-state inputs into a bounded success probability plus a full breakdown.
 * <p>
 * The formula, in order:
 * <ol>
 *   <li>spend term {@code log10(1 + spend/spendScale) * spendWeight}</li>
 *   <li>influence term {@code clamp(influence/influenceScale, 0, 1) * influenceWeight}</li>
 *   <li>proximity multiplier {@code 1 + proximityWeight * exp(-timeToEvent/halfLife)}</li>
 *   <li>composite contribution {@code 1 + composite * compositeFactor}</li>
 *   <li>core {@code base * (1+spend) * (1+influence) * composite * proximity}</li>
 *   <li>reputation term, linear or logistic</li>
 *   <li>prior success bonus, capped geometric series</li>
 *   <li>economic modifier on an asymmetric range</li>
 *   <li>jitter, only with a seed and spend above the threshold</li>
 *   <li>raw sum, soft easing above {@code softMax}, hard clamp to the bounds</li>
 * </ol>
 * The resolver is immutable and safe to share between threads. Transcendental functions come from
 * {@link FastMath}, a pure-Java implementation, so results do not depend on the host's intrinsics.
 */
public final class ProbabilityResolver {

    private final ProbabilityConfig config;

    public ProbabilityResolver(ProbabilityConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public ProbabilityConfig getConfig() {
        return config;
    }

    /**
     * Resolves the probability for a validated input.
     *
     * @param input The normalized input.
     * @return The breakdown, whose {@code finalProbability} is always within the configured bounds.
     * @throws ValidationException if the input's tier is unknown to this profile.
     */
    public ProbabilityBreakdown resolve(ProbabilityInput input) {
        Objects.requireNonNull(input, "input must not be null");
        double base = config.baseFor(input.getTierKey());

        double spendTerm = FastMath.log10(1.0 + input.getSpend() / config.getSpendScale()) * config.getSpendWeight();
        double influenceTerm = ProbabilityInput.clamp(input.getInfluence() / config.getInfluenceScale(), 0.0, 1.0)
            * config.getInfluenceWeight();
        double proximityMultiplier = 1.0 + config.getProximityWeight()
            * FastMath.exp(-input.getTimeToEvent() / config.getProximityHalfLife());
        double compositeContribution = 1.0 + input.getCompositeWeight() * config.getCompositeFactor();
        double core = base * (1.0 + spendTerm) * (1.0 + influenceTerm) * compositeContribution * proximityMultiplier;

        ReputationCurve curve = input.getReputationCurve().orElse(config.getReputationCurve());
        double reputationTerm = reputationTerm(curve, input.getReputation());
        double priorSuccessBonus = priorSuccessBonus(input.getPriorSuccessCount());
        double economicModifier = economicModifier(input.getEconomicSignal());
        double jitter = jitter(input);

        double raw = core + reputationTerm + priorSuccessBonus + economicModifier + jitter;
        double softened = raw > config.getSoftMax()
            ? config.getSoftMax() + (raw - config.getSoftMax()) * config.getEasingFactor()
            : raw;
        double finalProbability = ProbabilityInput.clamp(softened, config.getMinProbability(), config.getMaxProbability());

        return new ProbabilityBreakdown(
            config.getProfileName(), input.getTierKey(), curve,
            base, spendTerm, influenceTerm, compositeContribution, proximityMultiplier, core,
            reputationTerm, priorSuccessBonus, economicModifier, jitter,
            raw, softened, finalProbability);
    }

    /**
     * Resolves the probability and rolls against it with a deterministic value derived from {@code rollSeed}.
     *
     * @param input    The normalized input.
     * @param rollSeed Seed of the roll, distinct from the jitter seed.
     * @return The outcome; identical arguments always produce an identical outcome.
     */
    public ResolvedOutcome roll(ProbabilityInput input, String rollSeed) {
        ProbabilityBreakdown breakdown = resolve(input);
        double roll = DeterministicRandom.unitInterval(rollSeed);
        return new ResolvedOutcome(breakdown, roll, roll < breakdown.finalProbability());
    }

    double reputationTerm(ReputationCurve curve, double reputation) {
        return switch (curve) {
            case LINEAR -> ProbabilityInput.clamp(reputation, 0.0, 100.0) / 100.0 * config.getReputationWeight();
            case LOGISTIC -> config.getReputationWeight()
                / (1.0 + FastMath.exp(-config.getReputationSteepness() * (reputation - config.getReputationMidpoint())));
        };
    }

    double priorSuccessBonus(int priorCount) {
        double sum = 0.0;
        double term = config.getPriorBonusBase();
        for (int i = 0; i < priorCount; i++) {
            sum += term;
            if (sum >= config.getPriorBonusCap()) {
                return config.getPriorBonusCap();
            }
            term *= config.getPriorBonusDecay();
        }
        return Math.min(sum, config.getPriorBonusCap());
    }

    double economicModifier(double signal) {
        // economicMin is negative, so a negative signal maps onto [economicMin, 0]
        return signal >= 0.0 ? signal * config.getEconomicMax() : -signal * config.getEconomicMin();
    }

    double jitter(ProbabilityInput input) {
        if (input.getSeed().isEmpty() || input.getSpend() <= config.getJitterSpendThreshold()) {
            return 0.0;
        }
        return DeterministicRandom.normalized(input.getSeed().get()) * config.getJitterRange();
    }
}
