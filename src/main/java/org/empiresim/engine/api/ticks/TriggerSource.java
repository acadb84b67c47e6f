package org.empiresim.engine.api.ticks;

/**
 * What started a tick.
 */
public enum TriggerSource {
    /** The periodic schedule fired on time. */
    SCHEDULED,
    /** An operator triggered the tick. */
    MANUAL,
    /** The schedule detected missed ticks and jumped ahead. */
    CATCHUP
}
