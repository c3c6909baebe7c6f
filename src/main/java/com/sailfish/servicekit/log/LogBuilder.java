package com.sailfish.servicekit.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Objects;

/**
 * Builds {@link Log} instances.
 *
 * <pre>
 *   LogConfiguration config = new LogConfiguration().setName("orders").setLevel(Level.DEBUG);
 *   Log log = LogBuilder.builder().withConfiguration(config).build();
 *   log.info("Order accepted", "orderId", id);
 * </pre>
 *
 * A custom SLF4J {@link Logger} takes precedence over the configured name.
 */
public final class LogBuilder {

    private LogConfiguration configuration = new LogConfiguration();
    private Logger logger;
    private Level level;

    private LogBuilder() {
    }

    public static LogBuilder builder() {
        return new LogBuilder();
    }

    /** Shorthand for a logger built from the default configuration. */
    public static Log defaultLog() {
        return builder().build();
    }

    public LogBuilder withConfiguration(LogConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        return this;
    }

    public LogBuilder withLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        return this;
    }

    /** Overrides the level from the configuration. */
    public LogBuilder withLevel(Level level) {
        this.level = Objects.requireNonNull(level, "level cannot be null");
        return this;
    }

    public Log build() {
        Logger target = logger != null ? logger : LoggerFactory.getLogger(configuration.getName());
        Level threshold = level != null ? level : configuration.getLevel();
        return new Slf4jLog(target, threshold, configuration.getFields().toArray());
    }
}
