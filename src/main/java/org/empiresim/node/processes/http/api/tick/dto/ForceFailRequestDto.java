package org.empiresim.node.processes.http.api.tick.dto;

/**
 * @param reason Why the operator fails the tick
 */
public record ForceFailRequestDto(String reason) {
}
