package org.empiresim.runtime.offline;

import org.apache.commons.math3.util.FastMath;
import org.empiresim.runtime.model.ValidationException;

import java.util.Objects;

/**
 * Protects absent players from punitive state decay.
 * <p>
 * Pure functions without persistence. Processors call {@link #computeOfflineAdjustment} and never
 * re-implement the clamp or buff math themselves.
 */
public final class OfflineProtection {

    private OfflineProtection() {
        // Utility class
    }

    /**
     * Limits negative drift accumulated while offline.
     * <p>
     * Within the grace period the delta passes unchanged. Beyond it a negative delta is raised to at
     * least {@code -maxNegativeDriftPerWeek * (weeksOffline - gracePeriodWeeks)}. Positive deltas are
     * never touched.
     *
     * @param delta        The raw change.
     * @param weeksOffline Weeks the player was away.
     * @param config       Clamp tuning.
     * @return The clamped change.
     */
    public static double clampOfflineDrift(double delta, double weeksOffline, ClampConfig config) {
        Objects.requireNonNull(config, "config");
        requireFinite("delta", delta);
        requireFinite("weeksOffline", weeksOffline);
        if (weeksOffline < 0) {
            throw new ValidationException("weeksOffline must not be negative but was " + weeksOffline);
        }
        if (weeksOffline <= config.gracePeriodWeeks() || delta >= 0) {
            return delta;
        }
        double floor = -config.maxNegativeDriftPerWeek() * (weeksOffline - config.gracePeriodWeeks());
        return Math.max(delta, floor);
    }

    /**
     * Computes the catch-up multiplier {@code 1 + (maxBuff - 1) * (1 - exp(-weeks / halfLife))}.
     * Equal to 1 at zero weeks, non-decreasing, bounded by {@code maxBuff}.
     */
    public static double computeCatchUpBuff(double weeksOffline, double maxBuff, double halfLifeWeeks) {
        requireFinite("weeksOffline", weeksOffline);
        if (weeksOffline < 0) {
            throw new ValidationException("weeksOffline must not be negative but was " + weeksOffline);
        }
        if (maxBuff < 1.0 || !(halfLifeWeeks > 0)) {
            throw new ValidationException(String.format(
                "maxBuff must be >= 1 and halfLifeWeeks > 0 but were %s, %s", maxBuff, halfLifeWeeks));
        }
        double buff = 1.0 + (maxBuff - 1.0) * (1.0 - FastMath.exp(-weeksOffline / halfLifeWeeks));
        return Math.min(buff, maxBuff);
    }

    /**
     * Composes drift clamp and catch-up buff for a returning player.
     *
     * @param snapshot    The consumed snapshot.
     * @param currentWeek The current game week index.
     * @param rawDelta    The raw change computed for the absence.
     * @param config      Clamp tuning.
     * @return The adjustment.
     * @throws ValidationException if {@code currentWeek} lies before the capture.
     */
    public static OfflineAdjustment computeOfflineAdjustment(OfflineSnapshot snapshot, long currentWeek,
                                                             double rawDelta, ClampConfig config) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(config, "config");
        if (currentWeek < snapshot.capturedAtWeek()) {
            throw new ValidationException(String.format(
                "Current week %d lies before snapshot week %d for player '%s'",
                currentWeek, snapshot.capturedAtWeek(), snapshot.playerId()));
        }
        long weeksOffline = currentWeek - snapshot.capturedAtWeek();
        double adjusted = clampOfflineDrift(rawDelta, weeksOffline, config);
        double buff = computeCatchUpBuff(weeksOffline, config.maxCatchUpBuff(), config.catchUpHalfLifeWeeks());
        return new OfflineAdjustment(weeksOffline, rawDelta, adjusted, buff, snapshot.autopilotStrategy().profile());
    }

    private static void requireFinite(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ValidationException(field + " must be a finite number but was " + value);
        }
    }
}
