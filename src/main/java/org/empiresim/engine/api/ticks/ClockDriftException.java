package org.empiresim.engine.api.ticks;

/**
 * Computed game time moves backward or is otherwise inconsistent with the last completed tick.
 * Requires operator attention; the engine does not recover automatically.
 */
public class ClockDriftException extends IllegalStateException {

    public ClockDriftException(String message) {
        super(message);
    }
}
