package org.empiresim.runtime.probability;

import com.typesafe.config.Config;
import org.empiresim.runtime.random.DeterministicRandom;

import java.util.Objects;

/**
 * Research breakthrough probability and discovery-tier rolls, resolved through the shared
 * {@link ProbabilityResolver} with the {@code research} profile. The research area selects the tier.
 * <p>
 * A successful roll is graded into a {@link DiscoveryTier} by where the roll fell inside the success
 * band: the lowest {@code paradigmShiftFraction} of the band is a paradigm shift, up to
 * {@code significantFraction} is significant, the rest incremental.
 */
public final class BreakthroughOdds {

    public static final String PROFILE = "research";

    /** Research areas, used as tier keys. Harder areas have lower base rates. */
    public enum ResearchArea { EFFICIENCY, PERFORMANCE, MULTIMODAL, REASONING, ALIGNMENT, ARCHITECTURE }

    public enum DiscoveryTier { NONE, INCREMENTAL, SIGNIFICANT, PARADIGM_SHIFT }

    /**
     * One research cycle of a project.
     *
     * @param projectId           Research project.
     * @param area                Research area.
     * @param computeBudget       Compute spend of the cycle.
     * @param teamSkill           Average researcher skill 0-100, fed as influence.
     * @param labReputation       Reputation of the lab 0-100.
     * @param specializationMatch Fit of the team to the area, 0-1.
     * @param monthsToDeadline    Months until the project deadline.
     * @param priorBreakthroughs  Earlier breakthroughs of the project.
     * @param economicCondition   Economic condition signal -1..1.
     */
    public record ResearchAttempt(
        String projectId,
        ResearchArea area,
        double computeBudget,
        double teamSkill,
        double labReputation,
        double specializationMatch,
        double monthsToDeadline,
        int priorBreakthroughs,
        double economicCondition
    ) {
        public ResearchAttempt {
            Objects.requireNonNull(projectId, "projectId");
            Objects.requireNonNull(area, "area");
        }
    }

    /**
     * @param outcome The resolved probability and roll.
     * @param tier    The graded discovery, {@link DiscoveryTier#NONE} on failure.
     */
    public record Discovery(ResolvedOutcome outcome, DiscoveryTier tier) {
    }

    private final ProbabilityResolver resolver;
    private final double paradigmShiftFraction;
    private final double significantFraction;

    public BreakthroughOdds(ProbabilityResolver resolver, double paradigmShiftFraction, double significantFraction) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        if (paradigmShiftFraction < 0.0 || paradigmShiftFraction > significantFraction || significantFraction > 1.0) {
            throw new IllegalArgumentException(String.format(
                "Discovery fractions must satisfy 0 <= paradigmShift <= significant <= 1 but were %s, %s",
                paradigmShiftFraction, significantFraction));
        }
        this.paradigmShiftFraction = paradigmShiftFraction;
        this.significantFraction = significantFraction;
    }

    /**
     * Builds the odds from the {@code empiresim.probability} block, including its {@code discovery} fractions.
     */
    public static BreakthroughOdds fromConfig(Config probabilityConfig) {
        double paradigm = probabilityConfig.hasPath("discovery.paradigmShiftFraction")
            ? probabilityConfig.getDouble("discovery.paradigmShiftFraction")
            : 0.1;
        double significant = probabilityConfig.hasPath("discovery.significantFraction")
            ? probabilityConfig.getDouble("discovery.significantFraction")
            : 0.4;
        return new BreakthroughOdds(
            new ProbabilityResolver(ProbabilityConfig.fromConfig(probabilityConfig, PROFILE)), paradigm, significant);
    }

    public ProbabilityBreakdown calculate(ResearchAttempt attempt) {
        return resolver.resolve(toInput(attempt, null));
    }

    /**
     * Rolls one research cycle.
     *
     * @param attempt    The research attempt.
     * @param cycleIndex Index of the cycle (e.g. the game month), part of the seeds.
     * @return The graded discovery.
     */
    public Discovery roll(ResearchAttempt attempt, long cycleIndex) {
        String seed = DeterministicRandom.seedOf(attempt.projectId(), "research", attempt.area(), cycleIndex);
        ResolvedOutcome outcome = resolver.roll(toInput(attempt, seed), DeterministicRandom.seedOf(seed, "roll"));
        return new Discovery(outcome, grade(outcome));
    }

    DiscoveryTier grade(ResolvedOutcome outcome) {
        if (!outcome.success()) {
            return DiscoveryTier.NONE;
        }
        double p = outcome.probability();
        if (outcome.roll() < p * paradigmShiftFraction) {
            return DiscoveryTier.PARADIGM_SHIFT;
        }
        if (outcome.roll() < p * significantFraction) {
            return DiscoveryTier.SIGNIFICANT;
        }
        return DiscoveryTier.INCREMENTAL;
    }

    private ProbabilityInput toInput(ResearchAttempt attempt, String seed) {
        return ProbabilityInput.builder(attempt.area().name())
            .spend(attempt.computeBudget())
            .influence(attempt.teamSkill())
            .reputation(attempt.labReputation())
            .compositeWeight(attempt.specializationMatch())
            .timeToEvent(attempt.monthsToDeadline())
            .priorSuccessCount(attempt.priorBreakthroughs())
            .economicSignal(attempt.economicCondition())
            .seed(seed)
            .build();
    }
}
