package com.sailfish.servicekit.log;

import org.slf4j.Logger;
import org.slf4j.event.Level;

import java.util.Arrays;
import java.util.Objects;

/**
 * {@link Log} implementation writing to an SLF4J {@link Logger}.
 *
 * Entries are rendered as {@code message key=value key=value}; bound fields
 * come first. A trailing key without a value is paired with {@value #MISSING_VALUE}.
 */
public final class Slf4jLog implements Log {

    static final String MISSING_VALUE = "<missing>";

    private final Logger logger;
    private final Level threshold;
    private final Object[] fields;

    Slf4jLog(Logger logger, Level threshold, Object[] fields) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.threshold = Objects.requireNonNull(threshold, "threshold cannot be null");
        this.fields = fields == null ? new Object[0] : fields.clone();
    }

    @Override
    public void debug(String message, Object... keyValues) {
        if (isEnabled(Level.DEBUG)) {
            logger.debug("{}", render(message, keyValues));
        }
    }

    @Override
    public void info(String message, Object... keyValues) {
        if (isEnabled(Level.INFO)) {
            logger.info("{}", render(message, keyValues));
        }
    }

    @Override
    public void warn(String message, Object... keyValues) {
        if (isEnabled(Level.WARN)) {
            logger.warn("{}", render(message, keyValues));
        }
    }

    @Override
    public void error(String message, Object... keyValues) {
        if (isEnabled(Level.ERROR)) {
            logger.error("{}", render(message, keyValues));
        }
    }

    @Override
    public void error(String message, Throwable error, Object... keyValues) {
        if (isEnabled(Level.ERROR)) {
            logger.error(render(message, keyValues), error);
        }
    }

    @Override
    public Log with(Object... keyValues) {
        if (keyValues == null || keyValues.length == 0) {
            return this;
        }
        Object[] pairs = paired(keyValues);
        Object[] merged = Arrays.copyOf(fields, fields.length + pairs.length);
        System.arraycopy(pairs, 0, merged, fields.length, pairs.length);
        return new Slf4jLog(logger, threshold, merged);
    }

    /** {@code keyValues}, with {@value #MISSING_VALUE} appended when the last key has no value. */
    static Object[] paired(Object[] keyValues) {
        if (keyValues.length % 2 == 0) {
            return keyValues;
        }
        Object[] padded = Arrays.copyOf(keyValues, keyValues.length + 1);
        padded[keyValues.length] = MISSING_VALUE;
        return padded;
    }

    @Override
    public boolean isEnabled(Level level) {
        if (level.toInt() < threshold.toInt()) {
            return false;
        }
        switch (level) {
            case TRACE:
                return logger.isTraceEnabled();
            case DEBUG:
                return logger.isDebugEnabled();
            case INFO:
                return logger.isInfoEnabled();
            case WARN:
                return logger.isWarnEnabled();
            default:
                return logger.isErrorEnabled();
        }
    }

    public Logger getLogger() {
        return logger;
    }

    String render(String message, Object[] keyValues) {
        StringBuilder sb = new StringBuilder(message == null ? "" : message);
        appendPairs(sb, fields);
        appendPairs(sb, keyValues);
        return sb.toString();
    }

    private static void appendPairs(StringBuilder sb, Object[] keyValues) {
        if (keyValues == null) {
            return;
        }
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = i + 1 < keyValues.length ? keyValues[i + 1] : MISSING_VALUE;
            sb.append(' ').append(keyValues[i]).append('=').append(value);
        }
    }
}
