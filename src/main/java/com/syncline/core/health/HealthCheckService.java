package com.syncline.core.health;

import com.syncline.core.dedup.EventDeduplicator;
import com.syncline.core.dispatch.EventDispatcher;
import com.syncline.core.store.Projection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final EventDispatcher dispatcher;
    private final Projection projection;

    public HealthCheckService(EventDispatcher dispatcher, Projection projection) {
        this.dispatcher = dispatcher;
        this.projection = projection;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkOrdering());
        results.add(checkProjection());
        results.add(checkDeduplication());
        return results;
    }

    /**
     * Streams waiting on a sequence gap are degraded, not down: the timeout releases them.
     */
    private HealthStatus checkOrdering() {
        Set<String> backlogged = dispatcher.backloggedStreams();
        if (backlogged.isEmpty()) {
            return new HealthStatus("ordering", HealthStatus.Status.UP,
                    "No sequence gaps pending", Map.of());
        }
        int queued = backlogged.stream().mapToInt(id -> dispatcher.orderingStats(id).queueSize()).sum();
        return new HealthStatus("ordering", HealthStatus.Status.DEGRADED,
                backlogged.size() + " stream(s) waiting on a sequence gap",
                Map.of("streams", String.valueOf(backlogged.size()),
                        "queued", String.valueOf(queued)));
    }

    private HealthStatus checkProjection() {
        try {
            Map<String, String> counts = projection.read(p -> Map.of(
                    "sessions", String.valueOf(p.sessions().size()),
                    "messages", String.valueOf(p.messages().size()),
                    "parts", String.valueOf(p.parts().size()),
                    "pendingParts", String.valueOf(dispatcher.pendingPartCount())));
            return new HealthStatus("projection", HealthStatus.Status.UP, "Projection readable", counts);
        } catch (RuntimeException e) {
            log.warn("Projection health check failed: {}", e.getMessage());
            return new HealthStatus("projection", HealthStatus.Status.DOWN,
                    "Projection error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkDeduplication() {
        EventDeduplicator.Stats stats = dispatcher.dedupStats();
        return new HealthStatus("deduplication", HealthStatus.Status.UP,
                "Tracking " + stats.size() + " of " + stats.maxSize() + " event ids",
                Map.of("duplicates", String.valueOf(stats.duplicates())));
    }
}
