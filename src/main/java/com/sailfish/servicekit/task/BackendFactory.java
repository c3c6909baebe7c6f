package com.sailfish.servicekit.task;

import com.sailfish.servicekit.service.ServiceHost;

/**
 * Creates the backend of the task module from the service host.
 */
@FunctionalInterface
public interface BackendFactory {

    /**
     * @param host The service host the backend runs in.
     * @return The backend; never {@code null}.
     * @throws Exception if the backend cannot be created. Fatal for the task subsystem.
     */
    Backend create(ServiceHost host) throws Exception;
}
