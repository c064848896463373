package org.soulwars.node;

/**
 * Lifecycle contract of a long-running node service.
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

    /**
     * Starts the service in its own thread.
     *
     * @throws IllegalStateException if the service is not STOPPED
     */
    void start();

    /**
     * Requests a graceful stop and waits for the service thread to end.
     *
     * @throws IllegalStateException if the service is neither RUNNING nor PAUSED
     */
    void stop();

    void pause();

    void resume();

    State getCurrentState();
}
