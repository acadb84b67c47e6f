package org.empiresim.runtime.offline;

/**
 * Behavior applied on a player's behalf while they are offline.
 * Defensive trades efficiency for safety, Growth does the opposite.
 */
public enum AutopilotStrategy {
    DEFENSIVE(0.80, 0.50),
    BALANCED(1.00, 0.25),
    GROWTH(1.20, 0.05);

    private final double resourceEfficiencyMultiplier;
    private final double scandalProbabilityReduction;

    AutopilotStrategy(double resourceEfficiencyMultiplier, double scandalProbabilityReduction) {
        this.resourceEfficiencyMultiplier = resourceEfficiencyMultiplier;
        this.scandalProbabilityReduction = scandalProbabilityReduction;
    }

    public AutopilotProfile profile() {
        return new AutopilotProfile(this, resourceEfficiencyMultiplier, scandalProbabilityReduction);
    }

    /**
     * The fixed modifiers of a strategy, consumed by processors while the player is offline.
     *
     * @param strategy                     The strategy.
     * @param resourceEfficiencyMultiplier Multiplier on resource generation.
     * @param scandalProbabilityReduction  Fraction removed from scandal probabilities.
     */
    public record AutopilotProfile(
        AutopilotStrategy strategy,
        double resourceEfficiencyMultiplier,
        double scandalProbabilityReduction
    ) {
    }
}
