package com.sailfish.servicekit.task;

/**
 * Installation state of a {@link BackendRegistry}. Moves forward only:
 * {@code UNSET -> INITIALIZING -> READY | FAILED}.
 */
public enum RegistryState {
    /**
     * No install attempted; the no-op backend is current.
     */
    UNSET,
    /**
     * The backend factory is running; other install callers wait for it.
     */
    INITIALIZING,
    /**
     * A backend is installed and current.
     */
    READY,
    /**
     * The backend factory failed; the no-op backend stays current and install is not retried.
     */
    FAILED
}
