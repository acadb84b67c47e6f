package org.empiresim.runtime.offline;

/**
 * Result of applying offline protection to a raw state delta.
 *
 * @param weeksOffline  Weeks between capture and now.
 * @param rawDelta      Delta before protection.
 * @param adjustedDelta Delta after the drift clamp.
 * @param catchUpBuff   Multiplier granted to the returning player (at least 1).
 * @param autopilot     Modifiers of the snapshot's autopilot strategy.
 */
public record OfflineAdjustment(
    long weeksOffline,
    double rawDelta,
    double adjustedDelta,
    double catchUpBuff,
    AutopilotStrategy.AutopilotProfile autopilot
) {
}
