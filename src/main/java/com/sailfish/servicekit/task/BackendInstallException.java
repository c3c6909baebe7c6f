package com.sailfish.servicekit.task;

/**
 * The backend factory given to {@link BackendRegistry#install} failed.
 * Every caller of {@code install} sees an instance wrapping the same cause.
 */
public class BackendInstallException extends TaskException {

    private static final long serialVersionUID = 1L;

    public BackendInstallException(String message, Throwable cause) {
        super(message, cause);
    }
}
