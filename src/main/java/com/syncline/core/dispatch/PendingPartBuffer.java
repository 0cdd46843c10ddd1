package com.syncline.core.dispatch;

import com.syncline.core.model.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Holds parts that arrived before their message. Only the latest version of each part is kept.
 * <p>
 * Held parts expire after {@code maxAgeMs} and the buffer never holds more than {@code maxSize}
 * parts; the oldest are evicted first. Parts without a stream are refused, since nothing could
 * ever clear them.
 */
public class PendingPartBuffer {

    private static final Logger log = LoggerFactory.getLogger(PendingPartBuffer.class);

    public static final int DEFAULT_MAX_SIZE = 1000;

    private final Clock clock;
    private final long maxAgeMs;
    private final int maxSize;

    // insertion order is hold order, so the head is always the oldest
    private final LinkedHashMap<String, Held> byPartId = new LinkedHashMap<>();

    public PendingPartBuffer(Clock clock, long maxAgeMs) {
        this(clock, maxAgeMs, DEFAULT_MAX_SIZE);
    }

    public PendingPartBuffer(Clock clock, long maxAgeMs, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.clock = clock;
        this.maxAgeMs = maxAgeMs;
        this.maxSize = maxSize;
    }

    /**
     * @return false when the part was refused because it names no stream
     */
    public synchronized boolean hold(Part part) {
        if (part.streamId() == null) {
            return false;
        }
        long now = clock.millis();
        evictExpired(now);
        byPartId.remove(part.id());
        while (byPartId.size() >= maxSize) {
            Iterator<Held> oldest = byPartId.values().iterator();
            Held evicted = oldest.next();
            oldest.remove();
            log.warn("Pending part buffer full, dropping part {} of message {}",
                    evicted.part().id(), evicted.part().messageId());
        }
        byPartId.put(part.id(), new Held(part, now));
        return true;
    }

    /** Removes and returns the parts waiting for {@code messageId}, in arrival order. */
    public synchronized List<Part> drain(String messageId) {
        evictExpired(clock.millis());
        List<Part> drained = new ArrayList<>();
        Iterator<Held> it = byPartId.values().iterator();
        while (it.hasNext()) {
            Part part = it.next().part();
            if (messageId.equals(part.messageId())) {
                drained.add(part);
                it.remove();
            }
        }
        return drained;
    }

    /** Discards the parts held for a stream. */
    public synchronized void clearStream(String streamId) {
        byPartId.values().removeIf(held -> streamId.equals(held.part().streamId()));
    }

    public synchronized int size() {
        evictExpired(clock.millis());
        return byPartId.size();
    }

    public synchronized void clear() {
        byPartId.clear();
    }

    private void evictExpired(long now) {
        Iterator<Held> it = byPartId.values().iterator();
        while (it.hasNext()) {
            Held held = it.next();
            if (now - held.heldAt() <= maxAgeMs) {
                break;
            }
            it.remove();
            log.debug("Dropping part {}: message {} never arrived", held.part().id(), held.part().messageId());
        }
    }

    private record Held(Part part, long heldAt) {}
}
