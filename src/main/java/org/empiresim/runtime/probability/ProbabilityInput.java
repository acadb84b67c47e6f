package org.empiresim.runtime.probability;

import org.empiresim.runtime.model.ValidationException;

import java.util.Optional;

/**
 * Fully populated, validated input to {@link ProbabilityResolver}.
 * <p>
 * All optional values are defaulted and all bounded signals are clamped once, in {@link Builder#build()},
 * so the formula never deals with missing or out-of-range values. Non-finite numbers, negative spend,
 * negative time-to-event and negative prior counts are rejected with a {@link ValidationException}.
 */
public final class ProbabilityInput {

    private final String tierKey;
    private final double spend;
    private final double influence;
    private final double reputation;
    private final double compositeWeight;
    private final double timeToEvent;
    private final String seed;
    private final int priorSuccessCount;
    private final double economicSignal;
    private final ReputationCurve reputationCurve;

    private ProbabilityInput(Builder b) {
        this.tierKey = b.tierKey;
        this.spend = b.spend;
        this.influence = b.influence;
        this.reputation = clamp(b.reputation, 0.0, 100.0);
        this.compositeWeight = clamp(b.compositeWeight, 0.0, 1.0);
        this.timeToEvent = b.timeToEvent;
        this.seed = b.seed;
        this.priorSuccessCount = b.priorSuccessCount;
        this.economicSignal = clamp(b.economicSignal, -1.0, 1.0);
        this.reputationCurve = b.reputationCurve;
    }

    public static Builder builder(String tierKey) {
        return new Builder(tierKey);
    }

    public String getTierKey() { return tierKey; }
    public double getSpend() { return spend; }
    public double getInfluence() { return influence; }
    /** Reputation clamped to {@code [0, 100]}. */
    public double getReputation() { return reputation; }
    /** Composite weight clamped to {@code [0, 1]}. */
    public double getCompositeWeight() { return compositeWeight; }
    public double getTimeToEvent() { return timeToEvent; }
    public Optional<String> getSeed() { return Optional.ofNullable(seed); }
    public int getPriorSuccessCount() { return priorSuccessCount; }
    /** Economic condition clamped to {@code [-1, 1]}. */
    public double getEconomicSignal() { return economicSignal; }
    /** Curve override, empty to use the profile's default. */
    public Optional<ReputationCurve> getReputationCurve() { return Optional.ofNullable(reputationCurve); }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static final class Builder {
        private final String tierKey;
        private double spend;
        private double influence;
        private double reputation;
        private double compositeWeight;
        private double timeToEvent;
        private String seed;
        private int priorSuccessCount;
        private double economicSignal;
        private ReputationCurve reputationCurve;

        private Builder(String tierKey) {
            this.tierKey = tierKey;
        }

        public Builder spend(double spend) { this.spend = spend; return this; }
        public Builder influence(double influence) { this.influence = influence; return this; }
        public Builder reputation(double reputation) { this.reputation = reputation; return this; }
        public Builder compositeWeight(double compositeWeight) { this.compositeWeight = compositeWeight; return this; }
        public Builder timeToEvent(double timeToEvent) { this.timeToEvent = timeToEvent; return this; }
        public Builder seed(String seed) { this.seed = seed; return this; }
        public Builder priorSuccessCount(int priorSuccessCount) { this.priorSuccessCount = priorSuccessCount; return this; }
        public Builder economicSignal(double economicSignal) { this.economicSignal = economicSignal; return this; }
        public Builder reputationCurve(ReputationCurve reputationCurve) { this.reputationCurve = reputationCurve; return this; }

        /**
         * Validates and normalizes the collected values.
         *
         * @return The immutable input.
         * @throws ValidationException if a value cannot be used by the formula.
         */
        public ProbabilityInput build() {
            if (tierKey == null || tierKey.isBlank()) {
                throw new ValidationException("tierKey must not be blank");
            }
            requireFinite("spend", spend);
            requireFinite("influence", influence);
            requireFinite("reputation", reputation);
            requireFinite("compositeWeight", compositeWeight);
            requireFinite("timeToEvent", timeToEvent);
            requireFinite("economicSignal", economicSignal);
            if (spend < 0.0) {
                throw new ValidationException("spend must not be negative but was " + spend);
            }
            if (timeToEvent < 0.0) {
                throw new ValidationException("timeToEvent must not be negative but was " + timeToEvent);
            }
            if (priorSuccessCount < 0) {
                throw new ValidationException("priorSuccessCount must not be negative but was " + priorSuccessCount);
            }
            return new ProbabilityInput(this);
        }

        private static void requireFinite(String field, double value) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new ValidationException(field + " must be a finite number but was " + value);
            }
        }
    }
}
