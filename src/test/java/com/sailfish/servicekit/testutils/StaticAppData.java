package com.sailfish.servicekit.testutils;

import com.sailfish.servicekit.config.StaticConfigProvider;
import com.sailfish.servicekit.service.ServiceHost;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration fixtures holding a valid service name and owner.
 */
public final class StaticAppData {

    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private StaticAppData() {
    }

    /**
     * A provider with {@code name} and {@code owner} set. A {@code null} service name is replaced by a random one.
     */
    public static StaticConfigProvider provider(String serviceName) {
        return provider(serviceName, new HashMap<>());
    }

    /**
     * Same as {@link #provider(String)}, plus the given extra entries.
     */
    public static StaticConfigProvider provider(String serviceName, Map<String, ?> extra) {
        Map<String, Object> data = new HashMap<>(extra);
        data.put(ServiceHost.NAME_KEY, serviceName != null ? serviceName : "test" + randomLetters(10));
        data.put(ServiceHost.OWNER_KEY, "test" + randomLetters(10));
        return new StaticConfigProvider(data);
    }

    /** A host built from {@link #provider(String, Map)} with a fresh {@link SimpleMeterRegistry}. */
    public static ServiceHost host(Map<String, ?> extra) {
        return ServiceHost.fromConfig(provider(null, extra), new SimpleMeterRegistry());
    }

    public static ServiceHost host() {
        return host(new HashMap<>());
    }

    public static String randomLetters(int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) {
            sb.append(LETTERS.charAt(ThreadLocalRandom.current().nextInt(LETTERS.length())));
        }
        return sb.toString();
    }
}
