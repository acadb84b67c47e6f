package org.empiresim.runtime.probability;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.empiresim.runtime.model.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Balance constants of the probability formula for one usage profile (lobbying, research, ...).
 * <p>
 * Constants are configuration, not behavior. A profile is read from HOCON and falls back to the
 * shared {@code defaults} block:
 * <pre>
 * empiresim.probability {
 *   defaults { spendScale = 10000, spendWeight = 0.5, ... }
 *   profiles {
 *     lobbying { tiers { LOCAL = 0.30, STATE = 0.20, FEDERAL = 0.10 } }
 *   }
 * }
 * </pre>
 */
public final class ProbabilityConfig {

    private final String profileName;
    private final Map<String, Double> tierBases;
    private final double spendScale;
    private final double spendWeight;
    private final double influenceScale;
    private final double influenceWeight;
    private final double proximityWeight;
    private final double proximityHalfLife;
    private final double compositeFactor;
    private final ReputationCurve reputationCurve;
    private final double reputationWeight;
    private final double reputationSteepness;
    private final double reputationMidpoint;
    private final double priorBonusBase;
    private final double priorBonusDecay;
    private final double priorBonusCap;
    private final double economicMin;
    private final double economicMax;
    private final double jitterRange;
    private final double jitterSpendThreshold;
    private final double softMax;
    private final double easingFactor;
    private final double minProbability;
    private final double maxProbability;

    private ProbabilityConfig(Builder b) {
        this.profileName = b.profileName;
        this.tierBases = Collections.unmodifiableMap(new LinkedHashMap<>(b.tierBases));
        this.spendScale = b.spendScale;
        this.spendWeight = b.spendWeight;
        this.influenceScale = b.influenceScale;
        this.influenceWeight = b.influenceWeight;
        this.proximityWeight = b.proximityWeight;
        this.proximityHalfLife = b.proximityHalfLife;
        this.compositeFactor = b.compositeFactor;
        this.reputationCurve = b.reputationCurve;
        this.reputationWeight = b.reputationWeight;
        this.reputationSteepness = b.reputationSteepness;
        this.reputationMidpoint = b.reputationMidpoint;
        this.priorBonusBase = b.priorBonusBase;
        this.priorBonusDecay = b.priorBonusDecay;
        this.priorBonusCap = b.priorBonusCap;
        this.economicMin = b.economicMin;
        this.economicMax = b.economicMax;
        this.jitterRange = b.jitterRange;
        this.jitterSpendThreshold = b.jitterSpendThreshold;
        this.softMax = b.softMax;
        this.easingFactor = b.easingFactor;
        this.minProbability = b.minProbability;
        this.maxProbability = b.maxProbability;
        validate();
    }

    /**
     * Reads a named profile from the {@code empiresim.probability} block.
     *
     * @param probabilityConfig The {@code empiresim.probability} block.
     * @param profile           The profile name under {@code profiles}.
     * @return The merged profile.
     * @throws IllegalArgumentException if the profile does not exist or is inconsistent.
     */
    public static ProbabilityConfig fromConfig(Config probabilityConfig, String profile) {
        String profilePath = "profiles." + profile;
        if (!probabilityConfig.hasPath(profilePath)) {
            throw new IllegalArgumentException("Unknown probability profile '" + profile + "'");
        }
        Config defaults = probabilityConfig.hasPath("defaults")
            ? probabilityConfig.getConfig("defaults")
            : ConfigFactory.empty();
        Config merged = probabilityConfig.getConfig(profilePath).withFallback(defaults);

        Builder builder = builder(profile);
        if (merged.hasPath("tiers")) {
            for (Map.Entry<String, ConfigValue> tier : merged.getConfig("tiers").root().entrySet()) {
                builder.tier(tier.getKey(), ((Number) tier.getValue().unwrapped()).doubleValue());
            }
        }
        if (merged.hasPath("spendScale")) builder.spendScale = merged.getDouble("spendScale");
        if (merged.hasPath("spendWeight")) builder.spendWeight = merged.getDouble("spendWeight");
        if (merged.hasPath("influenceScale")) builder.influenceScale = merged.getDouble("influenceScale");
        if (merged.hasPath("influenceWeight")) builder.influenceWeight = merged.getDouble("influenceWeight");
        if (merged.hasPath("proximityWeight")) builder.proximityWeight = merged.getDouble("proximityWeight");
        if (merged.hasPath("proximityHalfLife")) builder.proximityHalfLife = merged.getDouble("proximityHalfLife");
        if (merged.hasPath("compositeFactor")) builder.compositeFactor = merged.getDouble("compositeFactor");
        if (merged.hasPath("reputation.curve")) {
            builder.reputationCurve = merged.getEnum(ReputationCurve.class, "reputation.curve");
        }
        if (merged.hasPath("reputation.weight")) builder.reputationWeight = merged.getDouble("reputation.weight");
        if (merged.hasPath("reputation.steepness")) builder.reputationSteepness = merged.getDouble("reputation.steepness");
        if (merged.hasPath("reputation.midpoint")) builder.reputationMidpoint = merged.getDouble("reputation.midpoint");
        if (merged.hasPath("priorBonus.base")) builder.priorBonusBase = merged.getDouble("priorBonus.base");
        if (merged.hasPath("priorBonus.decay")) builder.priorBonusDecay = merged.getDouble("priorBonus.decay");
        if (merged.hasPath("priorBonus.cap")) builder.priorBonusCap = merged.getDouble("priorBonus.cap");
        if (merged.hasPath("economic.min")) builder.economicMin = merged.getDouble("economic.min");
        if (merged.hasPath("economic.max")) builder.economicMax = merged.getDouble("economic.max");
        if (merged.hasPath("jitter.range")) builder.jitterRange = merged.getDouble("jitter.range");
        if (merged.hasPath("jitter.spendThreshold")) builder.jitterSpendThreshold = merged.getDouble("jitter.spendThreshold");
        if (merged.hasPath("softMax")) builder.softMax = merged.getDouble("softMax");
        if (merged.hasPath("easingFactor")) builder.easingFactor = merged.getDouble("easingFactor");
        if (merged.hasPath("minProbability")) builder.minProbability = merged.getDouble("minProbability");
        if (merged.hasPath("maxProbability")) builder.maxProbability = merged.getDouble("maxProbability");
        return builder.build();
    }

    public static Builder builder(String profileName) {
        return new Builder(profileName);
    }

    /**
     * Returns a builder pre-filled with this profile's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder(profileName);
        b.tierBases.putAll(tierBases);
        b.spendScale = spendScale;
        b.spendWeight = spendWeight;
        b.influenceScale = influenceScale;
        b.influenceWeight = influenceWeight;
        b.proximityWeight = proximityWeight;
        b.proximityHalfLife = proximityHalfLife;
        b.compositeFactor = compositeFactor;
        b.reputationCurve = reputationCurve;
        b.reputationWeight = reputationWeight;
        b.reputationSteepness = reputationSteepness;
        b.reputationMidpoint = reputationMidpoint;
        b.priorBonusBase = priorBonusBase;
        b.priorBonusDecay = priorBonusDecay;
        b.priorBonusCap = priorBonusCap;
        b.economicMin = economicMin;
        b.economicMax = economicMax;
        b.jitterRange = jitterRange;
        b.jitterSpendThreshold = jitterSpendThreshold;
        b.softMax = softMax;
        b.easingFactor = easingFactor;
        b.minProbability = minProbability;
        b.maxProbability = maxProbability;
        return b;
    }

    private void validate() {
        if (tierBases.isEmpty()) {
            throw new IllegalArgumentException("Probability profile '" + profileName + "' defines no tiers");
        }
        tierBases.forEach((tier, base) -> {
            if (!(base >= 0.0 && base <= 1.0)) {
                throw new IllegalArgumentException("Tier '" + tier + "' base must be in [0, 1] but was " + base);
            }
        });
        requirePositive("spendScale", spendScale);
        requirePositive("influenceScale", influenceScale);
        requirePositive("proximityHalfLife", proximityHalfLife);
        if (priorBonusDecay < 0.0 || priorBonusDecay >= 1.0) {
            throw new IllegalArgumentException("priorBonus.decay must be in [0, 1) but was " + priorBonusDecay);
        }
        if (economicMin > 0.0 || economicMax < 0.0) {
            throw new IllegalArgumentException("economic range must satisfy min <= 0 <= max");
        }
        if (easingFactor < 0.0 || easingFactor > 1.0) {
            throw new IllegalArgumentException("easingFactor must be in [0, 1] but was " + easingFactor);
        }
        if (minProbability < 0.0 || maxProbability > 1.0 || minProbability > maxProbability) {
            throw new IllegalArgumentException(String.format(
                "Probability bounds must satisfy 0 <= min <= max <= 1 but were [%s, %s]", minProbability, maxProbability));
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0)) {
            throw new IllegalArgumentException(name + " must be positive but was " + value);
        }
    }

    /**
     * Looks up the difficulty base for a tier key.
     *
     * @throws ValidationException if the tier is unknown.
     */
    public double baseFor(String tierKey) {
        Double base = tierBases.get(tierKey);
        if (base == null) {
            throw new ValidationException(String.format(
                "Unknown tier '%s' for profile '%s' (known: %s)", tierKey, profileName, tierBases.keySet()));
        }
        return base;
    }

    public String getProfileName() { return profileName; }
    public Map<String, Double> getTierBases() { return tierBases; }
    public double getSpendScale() { return spendScale; }
    public double getSpendWeight() { return spendWeight; }
    public double getInfluenceScale() { return influenceScale; }
    public double getInfluenceWeight() { return influenceWeight; }
    public double getProximityWeight() { return proximityWeight; }
    public double getProximityHalfLife() { return proximityHalfLife; }
    public double getCompositeFactor() { return compositeFactor; }
    public ReputationCurve getReputationCurve() { return reputationCurve; }
    public double getReputationWeight() { return reputationWeight; }
    public double getReputationSteepness() { return reputationSteepness; }
    public double getReputationMidpoint() { return reputationMidpoint; }
    public double getPriorBonusBase() { return priorBonusBase; }
    public double getPriorBonusDecay() { return priorBonusDecay; }
    public double getPriorBonusCap() { return priorBonusCap; }
    public double getEconomicMin() { return economicMin; }
    public double getEconomicMax() { return economicMax; }
    public double getJitterRange() { return jitterRange; }
    public double getJitterSpendThreshold() { return jitterSpendThreshold; }
    public double getSoftMax() { return softMax; }
    public double getEasingFactor() { return easingFactor; }
    public double getMinProbability() { return minProbability; }
    public double getMaxProbability() { return maxProbability; }

    /**
     * Mutable builder. Defaults match the shipped {@code reference.conf}.
     */
    public static final class Builder {
        private final String profileName;
        private final Map<String, Double> tierBases = new LinkedHashMap<>();
        private double spendScale = 10_000;
        private double spendWeight = 0.5;
        private double influenceScale = 1_000;
        private double influenceWeight = 0.25;
        private double proximityWeight = 0.2;
        private double proximityHalfLife = 4;
        private double compositeFactor = 0.2;
        private ReputationCurve reputationCurve = ReputationCurve.LOGISTIC;
        private double reputationWeight = 0.1;
        private double reputationSteepness = 0.1;
        private double reputationMidpoint = 50;
        private double priorBonusBase = 0.02;
        private double priorBonusDecay = 0.5;
        private double priorBonusCap = 0.05;
        private double economicMin = -0.05;
        private double economicMax = 0.03;
        private double jitterRange = 0.02;
        private double jitterSpendThreshold = 1_000;
        private double softMax = 0.85;
        private double easingFactor = 0.3;
        private double minProbability = 0.01;
        private double maxProbability = 0.95;

        private Builder(String profileName) {
            this.profileName = Objects.requireNonNull(profileName, "profileName");
        }

        public Builder tier(String key, double base) { tierBases.put(key, base); return this; }
        public Builder spendScale(double v) { spendScale = v; return this; }
        public Builder spendWeight(double v) { spendWeight = v; return this; }
        public Builder influenceScale(double v) { influenceScale = v; return this; }
        public Builder influenceWeight(double v) { influenceWeight = v; return this; }
        public Builder proximityWeight(double v) { proximityWeight = v; return this; }
        public Builder proximityHalfLife(double v) { proximityHalfLife = v; return this; }
        public Builder compositeFactor(double v) { compositeFactor = v; return this; }
        public Builder reputationCurve(ReputationCurve v) { reputationCurve = Objects.requireNonNull(v); return this; }
        public Builder reputationWeight(double v) { reputationWeight = v; return this; }
        public Builder reputationSteepness(double v) { reputationSteepness = v; return this; }
        public Builder reputationMidpoint(double v) { reputationMidpoint = v; return this; }
        public Builder priorBonus(double base, double decay, double cap) {
            priorBonusBase = base;
            priorBonusDecay = decay;
            priorBonusCap = cap;
            return this;
        }
        public Builder economicRange(double min, double max) { economicMin = min; economicMax = max; return this; }
        public Builder jitter(double range, double spendThreshold) {
            jitterRange = range;
            jitterSpendThreshold = spendThreshold;
            return this;
        }
        public Builder softMax(double v) { softMax = v; return this; }
        public Builder easingFactor(double v) { easingFactor = v; return this; }
        public Builder bounds(double min, double max) { minProbability = min; maxProbability = max; return this; }

        public ProbabilityConfig build() {
            return new ProbabilityConfig(this);
        }
    }
}
