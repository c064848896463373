package org.soulwars.node;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Base class for node services: thread handling, lifecycle state and error counting.
 * Subclasses implement {@link #run()}.
 * <p>
 * Shutdown is cooperative. {@link #stop()} sets a flag that {@link #run()} must poll through
 * {@link #isStopRequested()}, interrupts the thread to break a sleep, and waits up to
 * {@code shutdownTimeout} seconds. A thread that does not end in time leaves the service in ERROR.
 * </p>
 */
public abstract class AbstractService implements IService {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;

    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong errorCount = new AtomicLong();
    private final Object pauseLock = new Object();
    private final int shutdownTimeoutSeconds;
    private Thread serviceThread;

    /**
     * @param name    the service name, also used as thread name
     * @param options service options; {@code shutdownTimeout} (seconds, default 5) is read here
     */
    protected AbstractService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
        this.shutdownTimeoutSeconds = options.hasPath("shutdownTimeout") ? options.getInt("shutdownTimeout") : 5;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s",
                serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.start();
        logStarted();
    }

    /**
     * Logs the start of the service. Subclasses may override to add details.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s",
                serviceName, state));
        }
        stopRequested.set(true);
        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }
        if (serviceThread != null) {
            try {
                serviceThread.interrupt();
                serviceThread.join(shutdownTimeoutSeconds * 1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service shutdown", this.getClass().getSimpleName());
            }
            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} seconds! Forcing ERROR state.",
                    this.getClass().getSimpleName(), shutdownTimeoutSeconds);
                currentState.set(State.ERROR);
                return;
            }
        }
        if (getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.info("{} stopped", this.getClass().getSimpleName());
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s",
                serviceName, getCurrentState()));
        }
        log.info("{} paused", this.getClass().getSimpleName());
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s",
                serviceName, getCurrentState()));
        }
        log.info("{} resumed", this.getClass().getSimpleName());
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Runs {@link #run()} and maps its outcome to the lifecycle state: an interrupt or a normal return ends in
     * STOPPED, any other exception in ERROR (logged at ERROR, stack trace at DEBUG).
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}", this.getClass().getSimpleName(), e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    /**
     * The service's main loop, executed in a dedicated thread. Implementations check
     * {@link #isStopRequested()} and {@link #checkPause()} on every iteration.
     *
     * @throws InterruptedException if the service thread is interrupted
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks while the service is PAUSED.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED && !isStopRequested()) {
                pauseLock.wait();
            }
        }
    }

    protected boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Counts a transient failure that did not stop the service.
     */
    protected void recordError() {
        errorCount.incrementAndGet();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    /**
     * @return true unless the service is in ERROR or has recorded transient failures
     */
    public boolean isHealthy() {
        return getCurrentState() != State.ERROR && errorCount.get() == 0;
    }

    public String getServiceName() {
        return serviceName;
    }
}
