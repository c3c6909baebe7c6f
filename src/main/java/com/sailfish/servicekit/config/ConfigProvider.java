package com.sailfish.servicekit.config;

import java.util.Optional;

/**
 * Read-only source of configuration values keyed by dotted paths
 * (e.g. {@code "modules.task.inmemory.capacity"}).
 */
public interface ConfigProvider {

    /**
     * Looks up the raw value stored under the given key.
     *
     * @param key The dotted configuration key.
     * @return An Optional containing the value if present, empty otherwise.
     */
    Optional<Object> get(String key);

    default Optional<String> getString(String key) {
        return get(key).map(String::valueOf);
    }

    default String getString(String key, String defaultValue) {
        return getString(key).orElse(defaultValue);
    }

    /**
     * Reads an integer value, accepting numbers and numeric strings.
     *
     * @throws IllegalArgumentException if the value exists but is not numeric.
     */
    default int getInt(String key, int defaultValue) {
        Optional<Object> value = get(key);
        if (!value.isPresent()) {
            return defaultValue;
        }
        Object raw = value.get();
        if (raw instanceof Number) {
            return ((Number) raw).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not an integer: " + raw, e);
        }
    }

    /**
     * Reads a long value, accepting numbers and numeric strings.
     *
     * @throws IllegalArgumentException if the value exists but is not numeric.
     */
    default long getLong(String key, long defaultValue) {
        Optional<Object> value = get(key);
        if (!value.isPresent()) {
            return defaultValue;
        }
        Object raw = value.get();
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' is not a long: " + raw, e);
        }
    }
}
