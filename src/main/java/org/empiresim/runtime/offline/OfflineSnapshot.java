package org.empiresim.runtime.offline;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * State of a player captured when their session ends. Consumed once on the next login.
 *
 * @param playerId          The player.
 * @param capturedAtWeek    Game week index at capture.
 * @param capturedAt        Wall-clock capture time.
 * @param influence         Influence at capture.
 * @param approvalRating    Approval rating at capture, {@code null} if the player holds no office.
 * @param autopilotStrategy Strategy applied while offline.
 */
public record OfflineSnapshot(
    String playerId,
    long capturedAtWeek,
    Instant capturedAt,
    double influence,
    Double approvalRating,
    AutopilotStrategy autopilotStrategy
) {
    public OfflineSnapshot {
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(capturedAt, "capturedAt");
        if (capturedAtWeek < 0) {
            throw new IllegalArgumentException("capturedAtWeek must not be negative but was " + capturedAtWeek);
        }
        autopilotStrategy = autopilotStrategy == null ? AutopilotStrategy.BALANCED : autopilotStrategy;
    }

    public Optional<Double> approval() {
        return Optional.ofNullable(approvalRating);
    }
}
