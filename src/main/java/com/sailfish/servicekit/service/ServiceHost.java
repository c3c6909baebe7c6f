package com.sailfish.servicekit.service;

import com.sailfish.servicekit.config.ConfigProvider;
import com.sailfish.servicekit.log.Log;
import com.sailfish.servicekit.log.LogBuilder;
import com.sailfish.servicekit.log.LogConfiguration;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

/**
 * Environment handed to modules and backend factories while a service starts:
 * its identity, configuration, metrics registry and logger.
 */
public class ServiceHost {

    public static final String NAME_KEY = "name";
    public static final String OWNER_KEY = "owner";

    private final String name;
    private final String owner;
    private final ConfigProvider config;
    private final MeterRegistry metrics;
    private final Log log;

    public ServiceHost(String name, String owner, ConfigProvider config, MeterRegistry metrics, Log log) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("service name cannot be blank");
        }
        if (owner == null || owner.trim().isEmpty()) {
            throw new IllegalArgumentException("service owner cannot be blank");
        }
        this.name = name;
        this.owner = owner;
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.log = Objects.requireNonNull(log, "log cannot be null");
    }

    /**
     * Creates a host from the {@value #NAME_KEY} and {@value #OWNER_KEY} entries of the configuration.
     * The logger is named after the service.
     *
     * @throws IllegalArgumentException if either entry is missing or blank.
     */
    public static ServiceHost fromConfig(ConfigProvider config, MeterRegistry metrics) {
        Objects.requireNonNull(config, "config cannot be null");
        String name = config.getString(NAME_KEY)
                .orElseThrow(() -> new IllegalArgumentException("config is missing '" + NAME_KEY + "'"));
        String owner = config.getString(OWNER_KEY)
                .orElseThrow(() -> new IllegalArgumentException("config is missing '" + OWNER_KEY + "'"));
        Log log = LogBuilder.builder()
                .withConfiguration(new LogConfiguration().setName(name).addFields("service", name))
                .build();
        return new ServiceHost(name, owner, config, metrics, log);
    }

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public ConfigProvider getConfig() {
        return config;
    }

    public MeterRegistry getMetrics() {
        return metrics;
    }

    public Log getLog() {
        return log;
    }

    @Override
    public String toString() {
        return "ServiceHost{name='" + name + "', owner='" + owner + "'}";
    }
}
