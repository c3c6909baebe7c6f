package com.sailfish.servicekit.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link ConfigProvider} backed by an in-memory map.
 *
 * Keys may be stored flat ({@code "modules.http.port"}) or as nested maps
 * ({@code "modules" -> {"http" -> {"port" -> 8080}}}); a flat entry wins over
 * a nested one with the same path.
 */
public class StaticConfigProvider implements ConfigProvider {

    private final Map<String, Object> data;

    public StaticConfigProvider(Map<String, ?> data) {
        Objects.requireNonNull(data, "data cannot be null");
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static StaticConfigProvider empty() {
        return new StaticConfigProvider(Collections.emptyMap());
    }

    @Override
    public Optional<Object> get(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        if (data.containsKey(key)) {
            return Optional.ofNullable(data.get(key));
        }
        Object current = data;
        for (String part : key.split("\\.")) {
            if (!(current instanceof Map)) {
                return Optional.empty();
            }
            current = ((Map<?, ?>) current).get(part);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public Map<String, Object> asMap() {
        return data;
    }
}
