package org.empiresim.node.spi;

/**
 * Implemented by processes that expose a service to dependent processes.
 *
 * <p>A process declaring {@code require { engine = "engine" }} in its configuration receives the object
 * returned here under the local name {@code engine}.</p>
 */
public interface IServiceProvider {

    /**
     * @return The exposed service, or null if this process exposes none.
     */
    Object getExposedService();
}
