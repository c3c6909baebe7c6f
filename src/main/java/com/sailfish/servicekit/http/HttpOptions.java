package com.sailfish.servicekit.http;

import com.sailfish.servicekit.service.ModuleOption;
import com.sun.net.httpserver.Filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Options for {@link HttpModule#newModule}.
 */
public final class HttpOptions {

    private HttpOptions() {
    }

    /**
     * Appends filters applied to every incoming request. Filters from several
     * options accumulate in the order the options are given.
     */
    public static ModuleOption<HttpModuleConfig> withFilters(Filter... filters) {
        List<Filter> copy = new ArrayList<>(Arrays.asList(filters));
        if (copy.contains(null)) {
            throw new IllegalArgumentException("filters cannot contain null");
        }
        return config -> copy.forEach(config::addFilter);
    }

    /** Overrides the port read from configuration. */
    public static ModuleOption<HttpModuleConfig> withPort(int port) {
        return config -> config.setPort(port);
    }
}
