package com.sailfish.servicekit.task;

/**
 * A task function does not satisfy the registration contract. Raised at
 * registration time so the misuse surfaces during startup, not at invocation.
 */
public class TaskConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TaskConfigurationException(String message) {
        super(message);
    }

    public TaskConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
