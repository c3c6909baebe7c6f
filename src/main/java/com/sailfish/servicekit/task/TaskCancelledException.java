package com.sailfish.servicekit.task;

/**
 * Thrown when work is attempted on a {@link TaskContext} that is cancelled or past its deadline.
 */
public class TaskCancelledException extends TaskException {

    private static final long serialVersionUID = 1L;

    public TaskCancelledException(String message) {
        super(message);
    }
}
