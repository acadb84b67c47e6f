package org.empiresim.node.processes.http.api.tick.dto;

import org.empiresim.engine.api.ticks.TickEngineState;

import java.util.List;
import java.util.Map;

/**
 * Status of the tick engine as served by {@code GET status}.
 *
 * @param currentGameTime  Display form of the current game time, e.g. {@code Y2-M03 (#15)}
 * @param totalMonths      Canonical index of the current game time
 * @param missedTicks      Ticks due by the schedule but not yet run
 * @param processing       Whether a tick is running
 * @param runningTickId    Running tick, if any
 * @param currentProcessor Processor executing in the running tick, if any
 * @param lastTickId       Latest completed tick, if any
 * @param lastTickAt       Completion time of the latest completed tick, if any
 * @param ticksProcessed   Completed ticks
 * @param ticksFailed      Failed ticks
 * @param processors       Active processors in execution order
 * @param metrics          Metrics by component
 */
public record TickStatusDto(
    String currentGameTime,
    int totalMonths,
    int missedTicks,
    boolean processing,
    String runningTickId,
    String currentProcessor,
    String lastTickId,
    String lastTickAt,
    long ticksProcessed,
    long ticksFailed,
    List<String> processors,
    Map<String, Map<String, Number>> metrics
) {

    public static TickStatusDto from(final TickEngineState state, final List<String> processors,
                                     final Map<String, Map<String, Number>> metrics) {
        return new TickStatusDto(
            state.currentGameTime().toString(),
            state.currentGameTime().totalMonths(),
            state.missedTicks(),
            state.processing(),
            state.runningTickId(),
            state.currentProcessor(),
            state.lastTickId(),
            state.lastTickAt() == null ? null : state.lastTickAt().toString(),
            state.ticksProcessed(),
            state.ticksFailed(),
            processors,
            metrics);
    }
}
