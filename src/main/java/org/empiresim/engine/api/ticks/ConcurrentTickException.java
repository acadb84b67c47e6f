package org.empiresim.engine.api.ticks;

/**
 * A tick start was attempted while another tick is running. The caller should retry later.
 */
public class ConcurrentTickException extends IllegalStateException {

    public ConcurrentTickException(String message) {
        super(message);
    }
}
