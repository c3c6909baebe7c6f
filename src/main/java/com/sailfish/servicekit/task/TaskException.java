package com.sailfish.servicekit.task;

/**
 * Failure on the task path: publishing, decoding or running a task.
 */
public class TaskException extends Exception {

    private static final long serialVersionUID = 1L;

    public TaskException(String message) {
        super(message);
    }

    public TaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
