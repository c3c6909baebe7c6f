package com.sailfish.servicekit.service;

import java.util.Objects;

/**
 * What a {@link ModuleCreateFunc} receives: the module's name and the host it runs in.
 */
public final class ModuleCreateInfo {

    private final String name;
    private final ServiceHost host;

    public ModuleCreateInfo(String name, ServiceHost host) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("module name cannot be blank");
        }
        this.name = name;
        this.host = Objects.requireNonNull(host, "host cannot be null");
    }

    public String getName() {
        return name;
    }

    public ServiceHost getHost() {
        return host;
    }

    /** Prefix for this module's configuration keys, e.g. {@code "modules.http."}. */
    public String configPrefix() {
        return "modules." + name + ".";
    }
}
