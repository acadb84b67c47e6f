package org.empiresim.engine.api.ticks;

/**
 * Lifecycle of a tick record: {@code RUNNING -> COMPLETED | FAILED}. Finished records never change again.
 */
public enum TickStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
