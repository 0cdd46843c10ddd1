package com.syncline.core.dedup;

import java.util.LinkedHashSet;
import java.util.Iterator;

/**
 * Bounded window of recently seen event ids.
 * <p>
 * The first observation of an id marks it seen; later observations report a duplicate.
 * Only the {@code maxSize} most recently <em>first-seen</em> ids are remembered and the oldest
 * is evicted first, so a duplicate arriving after its id left the window is accepted again.
 * Duplicate checks do not refresh an id's position.
 */
public class EventDeduplicator {

    public static final int DEFAULT_MAX_SIZE = 1000;

    private final int maxSize;
    private final LinkedHashSet<String> seen = new LinkedHashSet<>();
    private long duplicates;

    public EventDeduplicator() {
        this(DEFAULT_MAX_SIZE);
    }

    public EventDeduplicator(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * Checks an id and records it when unseen.
     *
     * @return {@code true} if the id is inside the window (already seen)
     */
    public synchronized boolean isDuplicate(String eventId) {
        if (seen.contains(eventId)) {
            duplicates++;
            return true;
        }
        if (seen.size() >= maxSize) {
            Iterator<String> oldest = seen.iterator();
            oldest.next();
            oldest.remove();
        }
        seen.add(eventId);
        return false;
    }

    public synchronized int size() {
        return seen.size();
    }

    public synchronized Stats stats() {
        return new Stats(seen.size(), maxSize, duplicates);
    }

    public synchronized void clear() {
        seen.clear();
        duplicates = 0;
    }

    /**
     * @param size       ids currently remembered
     * @param maxSize    window capacity
     * @param duplicates duplicates detected since creation or the last {@link #clear()}
     */
    public record Stats(int size, int maxSize, long duplicates) {}
}
