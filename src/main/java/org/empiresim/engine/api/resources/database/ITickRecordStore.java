package org.empiresim.engine.api.resources.database;

import org.empiresim.engine.api.resources.IResource;
import org.empiresim.engine.api.ticks.TickNotFoundException;
import org.empiresim.engine.api.ticks.TickRecord;
import org.empiresim.engine.api.ticks.TickResult;
import org.empiresim.engine.api.ticks.TickStatus;
import org.empiresim.engine.api.ticks.TriggerSource;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of global tick records. The store is the final guard of the single-running-tick rule.
 */
public interface ITickRecordStore extends IResource {

    /**
     * Inserts a new {@link TickStatus#RUNNING} record.
     *
     * @param record The running record.
     * @return {@code false} if the tick id already exists or another tick is running; nothing is written then.
     */
    boolean insertRunning(TickRecord record);

    /**
     * Finishes a running record exactly once.
     *
     * @param tickId      The tick.
     * @param status      {@link TickStatus#COMPLETED} or {@link TickStatus#FAILED}.
     * @param result      The result, partial for failed ticks, may be {@code null}.
     * @param reason      Failure reason for failed ticks.
     * @param completedAt Completion time.
     * @return The finished record.
     * @throws TickNotFoundException if the tick does not exist.
     * @throws IllegalStateException if the tick is already finished.
     */
    TickRecord finish(String tickId, TickStatus status, TickResult result, String reason, Instant completedAt)
        throws TickNotFoundException;

    Optional<TickRecord> findById(String tickId);

    Optional<TickRecord> findRunning();

    /**
     * @return The completed record with the highest game time.
     */
    Optional<TickRecord> findLatestCompleted();

    /**
     * @return The completed {@link TriggerSource#SCHEDULED} or {@link TriggerSource#CATCHUP} record with
     *         the highest game time. Manual ticks are ignored, they may run ahead of the schedule.
     */
    Optional<TickRecord> findLatestScheduled();

    /**
     * @param limit Maximum number of records.
     * @return Most recently started records first.
     */
    List<TickRecord> findRecent(int limit);

    long countByStatus(TickStatus status);
}
