package com.syncline.core.config;

import com.syncline.core.correlation.CorrelationMatcher;
import com.syncline.core.dedup.EventDeduplicator;
import com.syncline.core.dispatch.PendingPartBuffer;
import com.syncline.core.reconciliation.ReconciliationEngine;
import com.syncline.core.store.Projection;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Composes the framework-free core into beans.
 */
@Configuration
public class SyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Projection projection() {
        return Projection.create();
    }

    @Bean
    public EventDeduplicator eventDeduplicator(SynclineProperties properties) {
        return new EventDeduplicator(properties.getDedupCacheSize());
    }

    @Bean
    public CorrelationMatcher correlationMatcher(SynclineProperties properties) {
        return new CorrelationMatcher(properties.getCorrelationWindowMs());
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(CorrelationMatcher matcher, Clock clock) {
        return new ReconciliationEngine(matcher, clock);
    }

    /** Parts whose message has not arrived within the correlation window are dropped. */
    @Bean
    public PendingPartBuffer pendingPartBuffer(Clock clock, SynclineProperties properties) {
        return new PendingPartBuffer(clock, properties.getCorrelationWindowMs());
    }

    /**
     * Single daemon thread for ordering timeouts. Timeouts only trigger a drain; the drain itself
     * runs under the dispatcher's per-stream lock.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService orderingScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "syncline-ordering");
            t.setDaemon(true);
            return t;
        });
    }
}
