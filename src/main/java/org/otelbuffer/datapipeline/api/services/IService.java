package org.otelbuffer.datapipeline.api.services;

/**
 * Lifecycle of a long-running component with its own thread.
 */
public interface IService {

    enum State {
        STOPPED,
        RUNNING,
        PAUSED,
        ERROR
    }

    /**
     * Starts the service thread.
     *
     * @throws IllegalStateException if the service is not STOPPED
     */
    void start();

    /**
     * Requests a graceful stop and waits up to the configured shutdown timeout.
     *
     * @throws IllegalStateException if the service is neither RUNNING nor PAUSED
     */
    void stop();

    void pause();

    void resume();

    State getCurrentState();
}
