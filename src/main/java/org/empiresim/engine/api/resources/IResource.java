package org.empiresim.engine.api.resources;

/**
 * Base interface of all resources (stores, pools) owned by the tick engine.
 */
public interface IResource {

    /**
     * Coarse operational state of a resource.
     */
    enum ResourceState {
        /** The resource is usable. */
        ACTIVE,
        /** The resource has recorded errors or lost its backing connection. */
        FAILED
    }

    /**
     * Returns the unique name of this resource instance from the configuration.
     *
     * @return The resource name.
     */
    String getResourceName();

    /**
     * Returns the current state of the resource.
     *
     * @return The resource state.
     */
    ResourceState getState();
}
