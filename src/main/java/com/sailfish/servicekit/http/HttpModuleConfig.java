package com.sailfish.servicekit.http;

import com.sun.net.httpserver.Filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Typed configuration of an {@link HttpModule}. Options built with {@link HttpOptions}
 * mutate it before the module is created.
 */
public class HttpModuleConfig {

    public static final String PORT_KEY = "port";
    public static final int DEFAULT_PORT = 0;

    private int port = DEFAULT_PORT;
    private final List<Filter> filters = new ArrayList<>();

    public int getPort() {
        return port;
    }

    /**
     * @param port TCP port to bind; 0 picks an ephemeral port.
     */
    public void setPort(int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.port = port;
    }

    /** Filters in the order they run for every request. */
    public List<Filter> getFilters() {
        return Collections.unmodifiableList(filters);
    }

    void addFilter(Filter filter) {
        filters.add(Objects.requireNonNull(filter, "filter cannot be null"));
    }
}
