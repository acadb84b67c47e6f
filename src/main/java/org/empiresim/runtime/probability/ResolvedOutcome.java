package org.empiresim.runtime.probability;

/**
 * A probability together with the deterministic roll made against it.
 *
 * @param breakdown The audit breakdown of the probability.
 * @param roll      Seed-derived value in {@code [0, 1)}.
 * @param success   {@code true} if {@code roll < finalProbability}.
 */
public record ResolvedOutcome(ProbabilityBreakdown breakdown, double roll, boolean success) {

    public double probability() {
        return breakdown.finalProbability();
    }
}
