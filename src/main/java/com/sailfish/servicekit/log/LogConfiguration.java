package com.sailfish.servicekit.log;

import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pre-build settings for a {@link Log}.
 */
public class LogConfiguration {

    public static final String DEFAULT_NAME = "servicekit";
    public static final Level DEFAULT_LEVEL = Level.INFO;

    private String name = DEFAULT_NAME;
    private Level level = DEFAULT_LEVEL;
    private final List<Object> fields = new ArrayList<>();

    public String getName() {
        return name;
    }

    public LogConfiguration setName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        this.name = name;
        return this;
    }

    public Level getLevel() {
        return level;
    }

    public LogConfiguration setLevel(Level level) {
        this.level = Objects.requireNonNull(level, "level cannot be null");
        return this;
    }

    /** Fields bound to every entry written by the built logger. */
    public List<Object> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public LogConfiguration addFields(Object... keyValues) {
        if (keyValues == null) {
            return this;
        }
        fields.addAll(Arrays.asList(Slf4jLog.paired(keyValues)));
        return this;
    }
}
