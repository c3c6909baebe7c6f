package com.sailfish.servicekit.task;

import com.sailfish.servicekit.service.Module;
import com.sailfish.servicekit.service.ModuleCreateFunc;
import com.sailfish.servicekit.service.ModuleCreateInfo;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;

/**
 * The asynchronous task module of a service. Wraps the backend installed in a
 * {@link BackendRegistry} and drives its lifecycle.
 */
public class TaskModule implements Module {

    private static final Logger log = LoggerFactory.getLogger(TaskModule.class);

    public static final String DEFAULT_NAME = "task";

    private final String name;
    private final Backend backend;

    TaskModule(String name, Backend backend) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.backend = Objects.requireNonNull(backend, "backend cannot be null");
    }

    /**
     * Returns a {@link ModuleCreateFunc} that installs the backend built by {@code factory}.
     * The first install also wires the task metrics into that host's meter registry.
     *
     * Because installation goes through {@code registry}, only the first module
     * created against it runs its factory; every other one shares that backend, or
     * fails with the same {@link BackendInstallException}.
     */
    public static ModuleCreateFunc newModule(BackendRegistry registry, BackendFactory factory) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        return info -> Collections.singletonList(create(registry, factory, info));
    }

    private static TaskModule create(BackendRegistry registry, BackendFactory factory, ModuleCreateInfo info)
            throws BackendInstallException {
        Backend backend = registry.install(info.getHost(), factory);
        log.info("Task module '{}' created for service '{}' on backend '{}'",
                info.getName(), info.getHost().getName(), backend.name());
        return new TaskModule(info.getName(), backend);
    }

    @Override
    public String name() {
        return name;
    }

    public Backend getBackend() {
        return backend;
    }

    /**
     * Starts the backend and its dispatch loop.
     */
    @Override
    @PostConstruct
    public void start() throws Exception {
        backend.start();
        backend.consume();
        log.info("Task module '{}' started.", name);
    }

    @Override
    @PreDestroy
    public void stop() {
        backend.stop();
        log.info("Task module '{}' stopped.", name);
    }
}
