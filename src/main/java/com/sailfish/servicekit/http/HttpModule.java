package com.sailfish.servicekit.http;

import com.sailfish.servicekit.service.Module;
import com.sailfish.servicekit.service.ModuleCreateFunc;
import com.sailfish.servicekit.service.ModuleCreateInfo;
import com.sailfish.servicekit.service.ModuleOption;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Serves one handler on the JDK HTTP server, behind the filters configured for the module.
 */
public class HttpModule implements Module {

    private static final Logger log = LoggerFactory.getLogger(HttpModule.class);

    private static final int STOP_DELAY_SECONDS = 1;

    private final String name;
    private final HttpHandler handler;
    private final HttpModuleConfig config;
    private volatile HttpServer server;

    HttpModule(String name, HttpHandler handler, HttpModuleConfig config) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Returns a {@link ModuleCreateFunc} for an HTTP module serving {@code handler}.
     * The port is read from {@code modules.<name>.port}; options are applied after, in order.
     */
    @SafeVarargs
    public static ModuleCreateFunc newModule(HttpHandler handler, ModuleOption<HttpModuleConfig>... options) {
        Objects.requireNonNull(handler, "handler cannot be null");
        List<ModuleOption<HttpModuleConfig>> opts = Arrays.asList(options);
        return info -> Collections.singletonList(new HttpModule(info.getName(), handler, configure(info, opts)));
    }

    static HttpModuleConfig configure(ModuleCreateInfo info, List<ModuleOption<HttpModuleConfig>> options) {
        HttpModuleConfig config = new HttpModuleConfig();
        config.setPort(info.getHost().getConfig().getInt(info.configPrefix() + HttpModuleConfig.PORT_KEY,
                HttpModuleConfig.DEFAULT_PORT));
        for (ModuleOption<HttpModuleConfig> option : options) {
            option.apply(config);
        }
        return config;
    }

    @Override
    public String name() {
        return name;
    }

    public HttpModuleConfig getConfig() {
        return config;
    }

    /**
     * The bound address, or {@code null} before start.
     */
    public InetSocketAddress getAddress() {
        HttpServer current = server;
        return current == null ? null : current.getAddress();
    }

    @Override
    @PostConstruct
    public synchronized void start() throws IOException {
        if (server != null) {
            return;
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(config.getPort()), 0);
        HttpContext context = created.createContext("/", handler);
        context.getFilters().addAll(config.getFilters());
        created.start();
        server = created;
        log.info("HTTP module '{}' listening on port {} with {} filter(s)",
                name, created.getAddress().getPort(), config.getFilters().size());
    }

    @Override
    @PreDestroy
    public synchronized void stop() {
        HttpServer current = server;
        if (current == null) {
            return;
        }
        server = null;
        current.stop(STOP_DELAY_SECONDS);
        log.info("HTTP module '{}' stopped.", name);
    }
}
