package org.empiresim.node.processes.http.api.tick.dto;

/**
 * Body of a manual trigger. Both fields are optional; {@code count} defaults to 1.
 *
 * @param count  Number of consecutive ticks to run
 * @param userId Operator that triggered the ticks
 */
public record TriggerTickRequestDto(Integer count, String userId) {

    public int countOrDefault() {
        return count == null ? 1 : count;
    }
}
