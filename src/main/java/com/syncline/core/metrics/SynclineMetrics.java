package com.syncline.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for the synchronization pipeline.
 */
@Service
public class SynclineMetrics {

    private final MeterRegistry registry;

    public SynclineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEnvelope(String outcome) {
        Counter.builder("syncline.envelopes.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a release of queued envelopes that skipped over a sequence gap.
     *
     * @param reason "timeout", "capacity" or "flush"
     */
    public void recordForcedRelease(String reason) {
        Counter.builder("syncline.ordering.forced_releases")
                .description("Ordering queues released with gaps")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordBatchSize(int size) {
        DistributionSummary.builder("syncline.ordering.batch_size")
                .register(registry)
                .record(size);
    }

    public void recordReconciliationMatch(String entity, String strategy) {
        Counter.builder("syncline.reconciliation.matches")
                .tag("entity", entity)
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void recordOrphansRemoved(String entity, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("syncline.orphans.removed")
                .tag("entity", entity)
                .register(registry)
                .increment(count);
    }

    /**
     * @param outcome "attempt" for each distinct retry status, then "recovered" or "exhausted"
     *                when the session goes idle again
     */
    public void recordSessionRetry(String outcome) {
        Counter.builder("syncline.session.retries")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordStoreRejection(String store) {
        Counter.builder("syncline.store.rejections")
                .description("Writes refused by referential-integrity checks")
                .tag("store", store)
                .register(registry)
                .increment();
    }

    public void recordHandlerFailure(String eventType) {
        Counter.builder("syncline.handler.failures")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordNotificationForwarded() {
        Counter.builder("syncline.notifications.forwarded")
                .register(registry)
                .increment();
    }
}
