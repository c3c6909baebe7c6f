package com.sailfish.servicekit.log;

import org.slf4j.event.Level;

/**
 * Structured logging API used by services and modules.
 *
 * Every logging method accepts a message followed by alternating keys and
 * values, e.g. {@code log.info("Task published", "function", id, "bytes", 42)}.
 * Instances are immutable; {@link #with(Object...)} returns a child logger
 * with additional bound fields.
 */
public interface Log {

    void debug(String message, Object... keyValues);

    void info(String message, Object... keyValues);

    void warn(String message, Object... keyValues);

    void error(String message, Object... keyValues);

    void error(String message, Throwable error, Object... keyValues);

    /**
     * Returns a logger that prefixes every entry with the given fields in
     * addition to the fields already bound to this logger.
     */
    Log with(Object... keyValues);

    boolean isEnabled(Level level);
}
