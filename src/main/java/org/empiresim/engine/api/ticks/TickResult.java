package org.empiresim.engine.api.ticks;

import org.empiresim.engine.api.processors.ProcessorResult;
import org.empiresim.runtime.model.GameTime;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Aggregated outcome of all processors for one tick.
 *
 * @param tickId              The tick.
 * @param gameTime            Game time the tick advanced to.
 * @param startedAt           Start of processing.
 * @param completedAt         End of processing.
 * @param durationMs          Processing duration.
 * @param processors          Per-processor results in execution order.
 * @param playersProcessed    Number of lagging players handed to the processors.
 * @param totalItemsProcessed Sum of processed items.
 * @param totalErrors         Sum of errors.
 * @param success             {@code true} if every processor succeeded.
 */
public record TickResult(
    String tickId,
    GameTime gameTime,
    Instant startedAt,
    Instant completedAt,
    long durationMs,
    List<ProcessorResult> processors,
    int playersProcessed,
    int totalItemsProcessed,
    int totalErrors,
    boolean success
) {

    public TickResult {
        processors = processors == null ? List.of() : List.copyOf(processors);
    }

    /**
     * Aggregates processor results.
     */
    public static TickResult aggregate(String tickId, GameTime gameTime, Instant startedAt, Instant completedAt,
                                       int playersProcessed, List<ProcessorResult> results) {
        int items = 0;
        int errors = 0;
        boolean success = true;
        for (ProcessorResult result : results) {
            items += result.itemsProcessed();
            errors += result.errorCount();
            success &= result.success();
        }
        return new TickResult(tickId, gameTime, startedAt, completedAt,
            Duration.between(startedAt, completedAt).toMillis(), results, playersProcessed, items, errors, success);
    }

    public List<String> processorNames() {
        return processors.stream().map(ProcessorResult::processor).toList();
    }
}
