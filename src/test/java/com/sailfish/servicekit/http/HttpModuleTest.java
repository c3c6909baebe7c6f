package com.sailfish.servicekit.http;

import com.sailfish.servicekit.service.ModuleCreateInfo;
import com.sailfish.servicekit.service.ServiceHost;
import com.sailfish.servicekit.testutils.StaticAppData;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpModuleTest {

    private static final HttpHandler OK = exchange -> {
        byte[] body = "ok".getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    };

    private static Filter recording(String name, List<String> calls) {
        return new Filter() {
            @Override
            public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
                calls.add(name);
                exchange.getResponseHeaders().add("X-Filter", name);
                chain.doFilter(exchange);
            }

            @Override
            public String description() {
                return name;
            }
        };
    }

    @Test
    void optionsAccumulateFiltersInOrder() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        Filter a = recording("a", calls);
        Filter b = recording("b", calls);
        Filter c = recording("c", calls);

        HttpModule module = (HttpModule) HttpModule.newModule(OK,
                HttpOptions.withFilters(a, b),
                HttpOptions.withFilters(c))
                .create(new ModuleCreateInfo("http", StaticAppData.host())).get(0);

        assertThat(module.getConfig().getFilters()).containsExactly(a, b, c);
    }

    @Test
    void noOptionsMeansNoFilters() throws Exception {
        HttpModule module = (HttpModule) HttpModule.newModule(OK)
                .create(new ModuleCreateInfo("http", StaticAppData.host())).get(0);

        assertThat(module.getConfig().getFilters()).isEmpty();
        assertThat(module.getConfig().getPort()).isEqualTo(HttpModuleConfig.DEFAULT_PORT);
    }

    @Test
    void portComesFromModuleConfigAndOptionsOverrideIt() throws Exception {
        ServiceHost host = StaticAppData.host(Collections.singletonMap("modules.web.port", 18080));

        HttpModule configured = (HttpModule) HttpModule.newModule(OK)
                .create(new ModuleCreateInfo("web", host)).get(0);
        HttpModule overridden = (HttpModule) HttpModule.newModule(OK, HttpOptions.withPort(0))
                .create(new ModuleCreateInfo("web", host)).get(0);

        assertThat(configured.getConfig().getPort()).isEqualTo(18080);
        assertThat(overridden.getConfig().getPort()).isEqualTo(0);
    }

    @Test
    void nullFilterIsRejected() {
        assertThatThrownBy(() -> HttpOptions.withFilters((Filter) null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requestsPassThroughFiltersInOrder() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        HttpModule module = (HttpModule) HttpModule.newModule(OK,
                HttpOptions.withFilters(recording("first", calls)),
                HttpOptions.withFilters(recording("second", calls)))
                .create(new ModuleCreateInfo("http", StaticAppData.host())).get(0);

        module.start();
        try {
            int port = module.getAddress().getPort();
            HttpResponse<String> response = HttpClient.newHttpClient().send(
                    HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/orders")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("ok");
            assertThat(response.headers().allValues("X-Filter")).containsExactly("first", "second");
            assertThat(calls).containsExactly("first", "second");
        } finally {
            module.stop();
            module.stop();
        }
        assertThat(module.getAddress()).isNull();
    }
}
