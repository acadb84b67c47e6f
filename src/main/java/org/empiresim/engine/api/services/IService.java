package org.empiresim.engine.api.services;

import org.empiresim.engine.api.resources.OperationalError;

import java.util.List;

/**
 * Lifecycle contract of a long-running engine service with its own thread.
 */
public interface IService {

    /**
     * Lifecycle states of a service.
     */
    enum State {
        STOPPED,
        RUNNING,
        PAUSED,
        ERROR
    }

    void start();

    void stop();

    void pause();

    void resume();

    /**
     * Stops and then starts the service.
     */
    void restart();

    State getCurrentState();

    List<OperationalError> getErrors();

    void clearErrors();
}
