package org.empiresim.runtime.probability;

/**
 * Every intermediate term of a resolved probability, in formula order.
 * Exists for auditing and UI display; it is never persisted as authoritative state.
 *
 * @param profile               Profile the constants were taken from.
 * @param tierKey               Tier key that selected {@code base}.
 * @param reputationCurve       Curve used for {@code reputationTerm}.
 * @param base                  Difficulty base of the tier.
 * @param spendTerm             {@code log10(1 + spend/scale) * weight}.
 * @param influenceTerm         Plateaued influence contribution.
 * @param compositeContribution {@code 1 + composite * factor}.
 * @param proximityMultiplier   {@code 1 + weight * exp(-timeToEvent/halfLife)}.
 * @param core                  Multiplicative core.
 * @param reputationTerm        Additive reputation contribution.
 * @param priorSuccessBonus     Capped geometric bonus for prior successes.
 * @param economicModifier      Asymmetric economic adjustment.
 * @param jitter                Seed-derived perturbation, 0 when not applied.
 * @param raw                   Sum before easing.
 * @param softened              Value after soft easing.
 * @param finalProbability      Hard-clamped result.
 */
public record ProbabilityBreakdown(
    String profile,
    String tierKey,
    ReputationCurve reputationCurve,
    double base,
    double spendTerm,
    double influenceTerm,
    double compositeContribution,
    double proximityMultiplier,
    double core,
    double reputationTerm,
    double priorSuccessBonus,
    double economicModifier,
    double jitter,
    double raw,
    double softened,
    double finalProbability
) {
}
