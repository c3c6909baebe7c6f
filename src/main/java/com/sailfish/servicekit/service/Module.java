package com.sailfish.servicekit.service;

/**
 * A unit of functionality started and stopped together with its service.
 */
public interface Module {

    String name();

    /**
     * Starts the module. Called once, after every module of the service has been created.
     *
     * @throws Exception if the module cannot start; the service should abort startup.
     */
    void start() throws Exception;

    /**
     * Stops the module and releases its resources. Must be safe to call more than once.
     */
    void stop();
}
