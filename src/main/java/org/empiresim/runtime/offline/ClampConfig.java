package org.empiresim.runtime.offline;

import com.typesafe.config.Config;

/**
 * Tuning of the offline protection.
 *
 * @param maxNegativeDriftPerWeek Largest loss per week beyond the grace period.
 * @param gracePeriodWeeks        Weeks during which deltas pass through unchanged.
 * @param maxCatchUpBuff          Asymptotic ceiling of the catch-up buff (at least 1).
 * @param catchUpHalfLifeWeeks    Time constant of the buff growth.
 */
public record ClampConfig(
    double maxNegativeDriftPerWeek,
    double gracePeriodWeeks,
    double maxCatchUpBuff,
    double catchUpHalfLifeWeeks
) {

    public static final ClampConfig DEFAULT = new ClampConfig(5.0, 2.0, 1.5, 4.0);

    public ClampConfig {
        if (maxNegativeDriftPerWeek < 0 || gracePeriodWeeks < 0) {
            throw new IllegalArgumentException("maxNegativeDriftPerWeek and gracePeriodWeeks must not be negative");
        }
        if (maxCatchUpBuff < 1.0) {
            throw new IllegalArgumentException("maxCatchUpBuff must be at least 1.0 but was " + maxCatchUpBuff);
        }
        if (!(catchUpHalfLifeWeeks > 0)) {
            throw new IllegalArgumentException("catchUpHalfLifeWeeks must be positive but was " + catchUpHalfLifeWeeks);
        }
    }

    /**
     * Reads the {@code empiresim.offline.clamp} block, falling back to {@link #DEFAULT} per key.
     */
    public static ClampConfig fromConfig(Config clamp) {
        return new ClampConfig(
            clamp.hasPath("maxNegativeDriftPerWeek") ? clamp.getDouble("maxNegativeDriftPerWeek") : DEFAULT.maxNegativeDriftPerWeek,
            clamp.hasPath("gracePeriodWeeks") ? clamp.getDouble("gracePeriodWeeks") : DEFAULT.gracePeriodWeeks,
            clamp.hasPath("maxCatchUpBuff") ? clamp.getDouble("maxCatchUpBuff") : DEFAULT.maxCatchUpBuff,
            clamp.hasPath("catchUpHalfLifeWeeks") ? clamp.getDouble("catchUpHalfLifeWeeks") : DEFAULT.catchUpHalfLifeWeeks);
    }
}
