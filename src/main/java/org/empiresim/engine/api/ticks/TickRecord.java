package org.empiresim.engine.api.ticks;

import org.empiresim.runtime.model.GameTime;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persisted record of one global tick. Created {@link TickStatus#RUNNING} at tick start and finished
 * exactly once, either {@link TickStatus#COMPLETED} (possibly with {@code success=false}) or
 * {@link TickStatus#FAILED}.
 *
 * @param tickId              Unique tick id.
 * @param gameTime            Game time this tick advances to.
 * @param triggeredBy         What started the tick.
 * @param triggeredByUserId   Operator for manual ticks, otherwise {@code null}.
 * @param startedAt           Start time.
 * @param completedAt         Finish time, {@code null} while running.
 * @param durationMs          Duration, {@code null} while running.
 * @param status              Lifecycle status.
 * @param success             {@code true} if completed with all processors succeeding.
 * @param processorsRun       Names of processors that ran.
 * @param totalItemsProcessed Items processed over all processors.
 * @param totalErrors         Errors over all processors.
 * @param result              Full (or partial, for failed ticks) result.
 * @param failureReason       Reason of a failed tick, otherwise {@code null}.
 */
public record TickRecord(
    String tickId,
    GameTime gameTime,
    TriggerSource triggeredBy,
    String triggeredByUserId,
    Instant startedAt,
    Instant completedAt,
    Long durationMs,
    TickStatus status,
    boolean success,
    List<String> processorsRun,
    int totalItemsProcessed,
    int totalErrors,
    TickResult result,
    String failureReason
) {

    public TickRecord {
        Objects.requireNonNull(tickId, "tickId");
        Objects.requireNonNull(gameTime, "gameTime");
        Objects.requireNonNull(triggeredBy, "triggeredBy");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(status, "status");
        processorsRun = processorsRun == null ? List.of() : List.copyOf(processorsRun);
    }

    public static TickRecord running(String tickId, GameTime gameTime, TriggerSource triggeredBy,
                                     String triggeredByUserId, Instant startedAt) {
        return new TickRecord(tickId, gameTime, triggeredBy, triggeredByUserId, startedAt,
            null, null, TickStatus.RUNNING, false, List.of(), 0, 0, null, null);
    }

    public boolean isRunning() {
        return status == TickStatus.RUNNING;
    }

    /**
     * Returns the finished copy of this record.
     *
     * @param finalStatus   {@link TickStatus#COMPLETED} or {@link TickStatus#FAILED}.
     * @param tickResult    Result, may be partial or {@code null} for failed ticks.
     * @param reason        Failure reason, ignored for completed ticks.
     * @param finishedAt    Completion time.
     * @return The finished record.
     * @throws IllegalStateException if this record is already finished.
     */
    public TickRecord finish(TickStatus finalStatus, TickResult tickResult, String reason, Instant finishedAt) {
        if (!isRunning()) {
            throw new IllegalStateException("Tick '" + tickId + "' is already finished with status " + status);
        }
        if (finalStatus == TickStatus.RUNNING) {
            throw new IllegalArgumentException("A tick cannot be finished as RUNNING");
        }
        boolean completed = finalStatus == TickStatus.COMPLETED;
        return new TickRecord(tickId, gameTime, triggeredBy, triggeredByUserId, startedAt,
            finishedAt,
            Duration.between(startedAt, finishedAt).toMillis(),
            finalStatus,
            completed && tickResult != null && tickResult.success(),
            tickResult == null ? List.of() : tickResult.processorNames(),
            tickResult == null ? 0 : tickResult.totalItemsProcessed(),
            tickResult == null ? 0 : tickResult.totalErrors(),
            tickResult,
            completed ? null : reason);
    }
}
