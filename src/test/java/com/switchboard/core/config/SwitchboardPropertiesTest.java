package com.switchboard.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SwitchboardPropertiesTest {

    @Test
    @DisplayName("defaults match the documented thresholds")
    void defaults() {
        var props = new SwitchboardProperties();

        assertEquals("", props.getCatalogLocation());
        assertEquals(0.9, props.getGenericAcceptThreshold());
        assertEquals(0.8, props.getCrossPlatformAcceptThreshold());
        assertEquals(Duration.ofSeconds(10), props.getGenerativeTimeout());
        assertEquals(Duration.ofMinutes(5), props.getCacheTtl());
        assertEquals(4, props.getResolver().getGenerativeThreads());
    }

    @Test
    @DisplayName("binds relaxed property names and duration strings")
    void binding() {
        var source = new MapConfigurationPropertySource(Map.of(
                "switchboard.catalog.location", "/etc/switchboard/intents.json",
                "switchboard.resolver.generic-accept-threshold", "0.95",
                "switchboard.resolver.generative-timeout", "3s",
                "switchboard.cache.ttl", "1m"));

        var props = new Binder(source).bind("switchboard", SwitchboardProperties.class).get();

        assertEquals("/etc/switchboard/intents.json", props.getCatalogLocation());
        assertEquals(0.95, props.getGenericAcceptThreshold());
        assertEquals(Duration.ofSeconds(3), props.getGenerativeTimeout());
        assertEquals(Duration.ofMinutes(1), props.getCacheTtl());
        assertEquals(0.8, props.getCrossPlatformAcceptThreshold());
    }

    @Test
    @DisplayName("worker threads are daemons with a name prefix")
    void namedDaemonThreads() {
        Thread thread = SwitchboardConfig.namedDaemonThreads("generative").newThread(() -> { });

        assertTrue(thread.isDaemon());
        assertEquals("generative-1", thread.getName());
    }
}
