package com.sailfish.servicekit.task;

import com.sailfish.servicekit.service.ServiceHost;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the one task backend of a process.
 *
 * Construct a single registry at startup and pass it to everything that enqueues
 * or consumes tasks. Until a backend is installed, {@link #current()} returns
 * {@link NopBackend}, which accepts and discards every message.
 *
 * <p>{@link #install} runs its factory at most once for the life of the registry.
 * Concurrent callers wait for that one run and all receive its outcome: the same
 * backend, or a {@link BackendInstallException} with the same cause. A failed
 * install is terminal; later calls report the same failure without running their
 * factory. Calls after a successful install return the installed backend and
 * ignore their factory and host. The task metrics are bound to the meter registry
 * of the host passed to the install that runs the factory.
 */
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final ReentrantLock installLock = new ReentrantLock();
    private final Condition installFinished = installLock.newCondition();
    // guarded by installLock
    private RegistryState state = RegistryState.UNSET;
    private Backend installed;
    private Throwable failure;

    private final ReadWriteLock currentLock = new ReentrantReadWriteLock();
    // guarded by currentLock
    private Backend current = NopBackend.INSTANCE;

    private volatile TaskMetrics metrics = TaskMetrics.noop();

    /**
     * Installs the backend built by {@code factory}, or returns the outcome of the install
     * that already ran.
     *
     * @param host    Host passed to the factory.
     * @param factory Builds the backend. Ignored unless this is the first call.
     * @return The installed backend.
     * @throws BackendInstallException if the (first) factory threw or returned {@code null}.
     */
    public Backend install(ServiceHost host, BackendFactory factory) throws BackendInstallException {
        Objects.requireNonNull(factory, "factory cannot be null");
        installLock.lock();
        try {
            while (state == RegistryState.INITIALIZING) {
                installFinished.awaitUninterruptibly();
            }
            if (state == RegistryState.READY) {
                log.debug("Task backend '{}' already installed, ignoring new factory", installed.name());
                return installed;
            }
            if (state == RegistryState.FAILED) {
                throw installFailure();
            }
            state = RegistryState.INITIALIZING;
        } finally {
            installLock.unlock();
        }

        Backend backend = null;
        Throwable error = null;
        try {
            if (host != null) {
                setupTaskMetrics(host.getMetrics());
            }
            backend = factory.create(host);
            if (backend == null) {
                error = new IllegalStateException("Backend factory returned null");
            }
        } catch (Throwable t) {
            error = t;
        } finally {
            finishInstall(backend, error);
        }

        if (error != null) {
            log.error("Task backend installation failed: {}", error.getMessage(), error);
            throw new BackendInstallException("Failed to install task backend: " + error.getMessage(), error);
        }
        log.info("Task backend '{}' installed", backend.name());
        return backend;
    }

    private void finishInstall(Backend backend, Throwable error) {
        if (error == null) {
            currentLock.writeLock().lock();
            try {
                current = backend;
            } finally {
                currentLock.writeLock().unlock();
            }
        }
        installLock.lock();
        try {
            if (error == null) {
                installed = backend;
                state = RegistryState.READY;
            } else {
                failure = error;
                state = RegistryState.FAILED;
            }
            installFinished.signalAll();
        } finally {
            installLock.unlock();
        }
    }

    private BackendInstallException installFailure() {
        return new BackendInstallException("Task backend installation previously failed: " + failure.getMessage(), failure);
    }

    /**
     * The installed backend, or {@link NopBackend#INSTANCE} if none is installed.
     */
    public Backend current() {
        currentLock.readLock().lock();
        try {
            return current;
        } finally {
            currentLock.readLock().unlock();
        }
    }

    public RegistryState state() {
        installLock.lock();
        try {
            return state;
        } finally {
            installLock.unlock();
        }
    }

    /**
     * Registers the task counters and timers with {@code registry}. Later calls replace the binding.
     * {@link #install} binds the host's registry on the one call that runs the factory.
     */
    public TaskMetrics setupTaskMetrics(MeterRegistry registry) {
        TaskMetrics bound = new TaskMetrics(registry);
        this.metrics = bound;
        return bound;
    }

    public TaskMetrics metrics() {
        return metrics;
    }
}
