package org.empiresim.runtime.probability;

/**
 * Shape used to turn a 0-100 reputation score into an additive probability term.
 */
public enum ReputationCurve {
    /** {@code clamp(rep, 0, 100) / 100 * weight}. */
    LINEAR,
    /** {@code weight / (1 + exp(-steepness * (rep - midpoint)))}. No discontinuity at the extremes. */
    LOGISTIC
}
