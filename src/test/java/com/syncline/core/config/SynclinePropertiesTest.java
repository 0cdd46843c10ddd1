package com.syncline.core.config;

import com.syncline.core.ordering.OrderingOptions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SynclinePropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new SynclineProperties();
        assertEquals(30_000L, props.getOrderingTimeoutMs());
        assertEquals(1000, props.getOrderingMaxQueueSize());
        assertEquals(1000, props.getDedupCacheSize());
        assertEquals(30_000L, props.getCorrelationWindowMs());
        assertEquals(OrderingOptions.defaults(), props.toOrderingOptions());
    }

    @Test
    void bindsRelaxedPropertyNames() {
        var source = new MapConfigurationPropertySource(Map.of(
                "syncline.ordering.timeout-ms", "5000",
                "syncline.ordering.max-queue-size", "50",
                "syncline.dedup.cache-size", "200",
                "syncline.correlation.window-ms", "10000"));

        var props = new Binder(source).bind("syncline", SynclineProperties.class).get();

        assertEquals(5000L, props.getOrderingTimeoutMs());
        assertEquals(50, props.getOrderingMaxQueueSize());
        assertEquals(200, props.getDedupCacheSize());
        assertEquals(10_000L, props.getCorrelationWindowMs());
        assertEquals(new OrderingOptions(5000L, 50), props.toOrderingOptions());
    }
}
