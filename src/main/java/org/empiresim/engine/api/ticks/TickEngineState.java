package org.empiresim.engine.api.ticks;

import org.empiresim.runtime.model.GameTime;

import java.time.Instant;

/**
 * Point-in-time view of the tick engine for status reporting.
 *
 * @param currentGameTime  Game time of the latest completed tick, or the initial time.
 * @param lastTickId       Id of the latest completed tick, {@code null} if none.
 * @param lastTickAt       Completion time of the latest completed tick, {@code null} if none.
 * @param ticksProcessed   Number of completed ticks.
 * @param ticksFailed      Number of failed ticks.
 * @param processing       {@code true} while a tick is running.
 * @param runningTickId    Id of the running tick, {@code null} if idle.
 * @param currentProcessor Processor currently executing, {@code null} if idle.
 * @param missedTicks      Ticks missed according to the schedule.
 */
public record TickEngineState(
    GameTime currentGameTime,
    String lastTickId,
    Instant lastTickAt,
    long ticksProcessed,
    long ticksFailed,
    boolean processing,
    String runningTickId,
    String currentProcessor,
    int missedTicks
) {
}
