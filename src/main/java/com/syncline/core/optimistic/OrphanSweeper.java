package com.syncline.core.optimistic;

import com.syncline.core.metrics.SynclineMetrics;
import com.syncline.core.reconciliation.ReconciliationEngine;
import com.syncline.core.store.Projection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Removes optimistic entities of a stream that outlived the correlation window without a
 * canonical counterpart, typically because the request behind them failed.
 */
@Service
public class OrphanSweeper {

    private static final Logger log = LoggerFactory.getLogger(OrphanSweeper.class);

    private final Projection projection;
    private final ReconciliationEngine engine;
    private final SynclineMetrics metrics;

    public OrphanSweeper(Projection projection, ReconciliationEngine engine, SynclineMetrics metrics) {
        this.projection = projection;
        this.engine = engine;
        this.metrics = metrics;
    }

    /**
     * Removes orphaned optimistic parts, then orphaned optimistic messages with their parts.
     *
     * @return number of entities removed directly (cascaded parts are not counted)
     */
    public int sweep(String streamId) {
        return projection.batch(() -> {
            List<String> parts = engine.findOrphanedOptimisticEntities(
                    projection.parts().optimisticByStream(streamId));
            int removedParts = 0;
            for (String id : parts) {
                if (projection.parts().remove(id)) {
                    removedParts++;
                }
            }

            List<String> messages = engine.findOrphanedOptimisticEntities(
                    projection.messages().optimisticByStream(streamId));
            int removedMessages = 0;
            for (String id : messages) {
                if (projection.messages().remove(id)) {
                    removedMessages++;
                }
            }

            if (removedParts + removedMessages > 0) {
                log.info("Removed {} orphaned optimistic messages and {} parts from stream {}",
                        removedMessages, removedParts, streamId);
                metrics.recordOrphansRemoved("message", removedMessages);
                metrics.recordOrphansRemoved("part", removedParts);
            }
            return removedParts + removedMessages;
        });
    }
}
