package org.empiresim.node.processes.http.api.tick.dto;

import org.empiresim.engine.api.ticks.TickRecord;

import java.util.List;

/**
 * JSON view of a {@link TickRecord} without the per-processor details.
 */
public record TickRecordDto(
    String tickId,
    int year,
    int month,
    int totalMonths,
    String triggeredBy,
    String triggeredByUserId,
    String startedAt,
    String completedAt,
    Long durationMs,
    String status,
    boolean success,
    List<String> processorsRun,
    int totalItemsProcessed,
    int totalErrors,
    String failureReason
) {

    public static TickRecordDto from(final TickRecord record) {
        return new TickRecordDto(
            record.tickId(),
            record.gameTime().year(),
            record.gameTime().month(),
            record.gameTime().totalMonths(),
            record.triggeredBy().name(),
            record.triggeredByUserId(),
            record.startedAt().toString(),
            record.completedAt() == null ? null : record.completedAt().toString(),
            record.durationMs(),
            record.status().name(),
            record.success(),
            record.processorsRun(),
            record.totalItemsProcessed(),
            record.totalErrors(),
            record.failureReason());
    }
}
