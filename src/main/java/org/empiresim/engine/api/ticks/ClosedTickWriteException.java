package org.empiresim.engine.api.ticks;

/**
 * A processor tried to write player progress for a tick that is no longer running, typically a worker
 * that outlived its tick's timeout or an operator failure. The write is discarded.
 */
public class ClosedTickWriteException extends IllegalStateException {

    private final String tickId;

    public ClosedTickWriteException(String tickId, String message) {
        super(message);
        this.tickId = tickId;
    }

    public String getTickId() {
        return tickId;
    }
}
