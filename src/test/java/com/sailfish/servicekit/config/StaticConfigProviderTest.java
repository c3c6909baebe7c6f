package com.sailfish.servicekit.config;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StaticConfigProviderTest {

    @Test
    void resolvesFlatAndNestedKeys() {
        Map<String, Object> data = new HashMap<>();
        data.put("name", "orders");
        data.put("modules", Collections.singletonMap("http", Collections.singletonMap("port", 8080)));
        data.put("modules.task.inmemory.workers", "3");
        ConfigProvider config = new StaticConfigProvider(data);

        assertThat(config.getString("name")).contains("orders");
        assertThat(config.getInt("modules.http.port", 0)).isEqualTo(8080);
        assertThat(config.getInt("modules.task.inmemory.workers", 1)).isEqualTo(3);
        assertThat(config.getLong("modules.http.port", 0L)).isEqualTo(8080L);
    }

    @Test
    void missingKeysFallBackToDefaults() {
        ConfigProvider config = StaticConfigProvider.empty();

        assertThat(config.get("anything")).isEmpty();
        assertThat(config.get("")).isEmpty();
        assertThat(config.getString("owner", "nobody")).isEqualTo("nobody");
        assertThat(config.getInt("modules.http.port", 9090)).isEqualTo(9090);
    }

    @Test
    void pathThroughScalarIsMissing() {
        ConfigProvider config = new StaticConfigProvider(Collections.singletonMap("modules", "flat"));

        assertThat(config.get("modules.http")).isEmpty();
    }

    @Test
    void nonNumericValueIsRejected() {
        ConfigProvider config = new StaticConfigProvider(Collections.singletonMap("port", "eighty"));

        assertThatThrownBy(() -> config.getInt("port", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("port");
    }
}
