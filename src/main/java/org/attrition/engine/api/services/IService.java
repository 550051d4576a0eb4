package org.attrition.engine.api.services;

import org.attrition.engine.api.resources.OperationalError;

import java.util.List;

/**
 * A background service of the engine with a start/stop/pause lifecycle. The game loop is the
 * only one today.
 */
public interface IService {

    enum State {
        STOPPED,
        RUNNING,
        /** Still alive, but skips its work until resumed. */
        PAUSED,
        /** The run loop died with an unexpected exception. */
        ERROR
    }

    /**
     * @throws IllegalStateException unless the service is {@link State#STOPPED}
     */
    void start();

    /**
     * Signals the service to stop. A call in any state other than running or paused is ignored.
     */
    void stop();

    void pause();

    void resume();

    State getCurrentState();

    List<OperationalError> getErrors();

    void clearErrors();
}
