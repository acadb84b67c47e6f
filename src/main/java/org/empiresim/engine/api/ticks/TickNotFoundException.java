package org.empiresim.engine.api.ticks;

/**
 * Thrown when a tick id is unknown to the tick record store.
 */
public class TickNotFoundException extends Exception {

    private final String tickId;

    public TickNotFoundException(String tickId) {
        super("Tick '" + tickId + "' not found");
        this.tickId = tickId;
    }

    public String getTickId() {
        return tickId;
    }
}
