package com.sailfish.servicekit.service;

import com.sailfish.servicekit.config.StaticConfigProvider;
import com.sailfish.servicekit.testutils.StaticAppData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceHostTest {

    @Test
    void readsIdentityFromConfig() {
        ServiceHost host = ServiceHost.fromConfig(StaticAppData.provider("orders"), new SimpleMeterRegistry());

        assertThat(host.getName()).isEqualTo("orders");
        assertThat(host.getOwner()).startsWith("test").hasSize(14);
        assertThat(host.getLog()).isNotNull();
    }

    @Test
    void randomNameWhenNoneGiven() {
        ServiceHost first = StaticAppData.host();
        ServiceHost second = StaticAppData.host();

        assertThat(first.getName()).startsWith("test").hasSize(14);
        assertThat(first.getName()).isNotEqualTo(second.getName());
    }

    @Test
    void missingOwnerIsRejected() {
        StaticConfigProvider config = new StaticConfigProvider(Collections.singletonMap("name", "orders"));

        assertThatThrownBy(() -> ServiceHost.fromConfig(config, new SimpleMeterRegistry()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("owner");
    }

    @Test
    void moduleCreateInfoScopesConfigKeys() {
        ModuleCreateInfo info = new ModuleCreateInfo("http", StaticAppData.host());

        assertThat(info.configPrefix()).isEqualTo("modules.http.");
        assertThatThrownBy(() -> new ModuleCreateInfo("", info.getHost()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
