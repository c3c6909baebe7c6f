package com.sailfish.servicekit.task;

/**
 * Thrown when a function identifier has no entry in the {@link TaskFunctionRegistry}.
 */
public class TaskNotRegisteredException extends TaskException {

    private static final long serialVersionUID = 1L;

    private final String functionId;

    public TaskNotRegisteredException(String functionId) {
        super("No task function registered for '" + functionId + "'");
        this.functionId = functionId;
    }

    public String getFunctionId() {
        return functionId;
    }
}
