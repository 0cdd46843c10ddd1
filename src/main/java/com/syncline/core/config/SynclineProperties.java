package com.syncline.core.config;

import com.syncline.core.ordering.OrderingOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "syncline")
public class SynclineProperties {

    private Ordering ordering = new Ordering();
    private Dedup dedup = new Dedup();
    private Correlation correlation = new Correlation();

    // -- flat accessors (delegate to nested) --
    public long getOrderingTimeoutMs() { return ordering.timeoutMs; }
    public int getOrderingMaxQueueSize() { return ordering.maxQueueSize; }
    public int getDedupCacheSize() { return dedup.cacheSize; }
    public long getCorrelationWindowMs() { return correlation.windowMs; }

    public OrderingOptions toOrderingOptions() {
        return new OrderingOptions(ordering.timeoutMs, ordering.maxQueueSize);
    }

    public Ordering getOrdering() { return ordering; }
    public void setOrdering(Ordering ordering) { this.ordering = ordering; }
    public Dedup getDedup() { return dedup; }
    public void setDedup(Dedup dedup) { this.dedup = dedup; }
    public Correlation getCorrelation() { return correlation; }
    public void setCorrelation(Correlation correlation) { this.correlation = correlation; }

    public static class Ordering {
        private long timeoutMs = 30_000;
        private int maxQueueSize = 1000;

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
        public int getMaxQueueSize() { return maxQueueSize; }
        public void setMaxQueueSize(int maxQueueSize) { this.maxQueueSize = maxQueueSize; }
    }

    public static class Dedup {
        private int cacheSize = 1000;

        public int getCacheSize() { return cacheSize; }
        public void setCacheSize(int cacheSize) { this.cacheSize = cacheSize; }
    }

    public static class Correlation {
        private long windowMs = 30_000;

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }
    }
}
