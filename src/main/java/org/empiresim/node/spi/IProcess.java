package org.empiresim.node.spi;

/**
 * A long-running, manageable part of the node (tick engine, HTTP server) with an explicit lifecycle.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block; continuous work runs on the process's own threads.
     */
    void start();

    /**
     * Stops the process and releases its resources.
     */
    void stop();
}
