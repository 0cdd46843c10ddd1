package com.syncline.core.store;

import com.syncline.core.model.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Parts keyed by id and indexed by message in insertion order.
 * <p>
 * A part is only accepted when its message exists according to the injected message check.
 * Not thread-safe on its own; {@link Projection} guards access.
 */
public class PartStore {

    private static final Logger log = LoggerFactory.getLogger(PartStore.class);

    private final Map<String, Part> byId = new LinkedHashMap<>();
    private final Map<String, Set<String>> byMessage = new LinkedHashMap<>();
    private final Predicate<String> messageExists;
    private final StoreObserver observer;

    public PartStore(Predicate<String> messageExists, StoreObserver observer) {
        this.messageExists = messageExists;
        this.observer = observer;
    }

    /**
     * Inserts or replaces a part.
     *
     * @return false if the owning message is unknown
     */
    public boolean upsert(Part part) {
        if (!messageExists.test(part.messageId())) {
            log.warn("Rejected part {}: message {} does not exist", part.id(), part.messageId());
            observer.rejected("part", part.id(), "unknown message " + part.messageId());
            return false;
        }
        Part previous = byId.put(part.id(), part);
        if (previous != null && !previous.messageId().equals(part.messageId())) {
            unindex(previous);
        }
        byMessage.computeIfAbsent(part.messageId(), k -> new LinkedHashSet<>()).add(part.id());
        observer.changed(part.streamId());
        return true;
    }

    public boolean remove(String partId) {
        Part removed = byId.remove(partId);
        if (removed == null) {
            return false;
        }
        unindex(removed);
        observer.changed(removed.streamId());
        return true;
    }

    /**
     * Removes every part of a message.
     *
     * @return the number of parts removed
     */
    public int removeByMessage(String messageId) {
        Set<String> ids = byMessage.get(messageId);
        if (ids == null) {
            return 0;
        }
        int removed = 0;
        for (String id : List.copyOf(ids)) {
            if (remove(id)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Moves every part of {@code fromMessageId} to {@code toMessageId}, keeping their order.
     *
     * @return the number of parts moved
     */
    public int reparent(String fromMessageId, String toMessageId) {
        int moved = 0;
        for (Part part : byMessage(fromMessageId)) {
            if (upsert(part.withMessageId(toMessageId))) {
                moved++;
            }
        }
        return moved;
    }

    public Optional<Part> getById(String partId) {
        return Optional.ofNullable(byId.get(partId));
    }

    public List<Part> byMessage(String messageId) {
        Set<String> ids = byMessage.get(messageId);
        if (ids == null) {
            return List.of();
        }
        return ids.stream().map(byId::get).toList();
    }

    public List<Part> optimisticByStream(String streamId) {
        return byId.values().stream()
                .filter(p -> p.isOptimistic() && streamId.equals(p.streamId()))
                .toList();
    }

    public int size() {
        return byId.size();
    }

    private void unindex(Part part) {
        Set<String> ids = byMessage.get(part.messageId());
        if (ids != null) {
            ids.remove(part.id());
            if (ids.isEmpty()) {
                byMessage.remove(part.messageId());
            }
        }
    }
}
