package com.syncline.core.store;

import com.syncline.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Messages keyed by id and indexed by stream in insertion order.
 * <p>
 * A message is only accepted when its stream exists according to the injected session check.
 * Not thread-safe on its own; {@link Projection} guards access.
 */
public class MessageStore {

    private static final Logger log = LoggerFactory.getLogger(MessageStore.class);

    private final Map<String, Message> byId = new LinkedHashMap<>();
    private final Map<String, Set<String>> byStream = new LinkedHashMap<>();
    private final List<Consumer<Message>> deleteHooks = new ArrayList<>();
    private final Predicate<String> sessionExists;
    private final StoreObserver observer;

    public MessageStore(Predicate<String> sessionExists, StoreObserver observer) {
        this.sessionExists = sessionExists;
        this.observer = observer;
    }

    /** Registers a hook run after a message has been removed. */
    public void onDelete(Consumer<Message> hook) {
        deleteHooks.add(hook);
    }

    /**
     * Inserts or replaces a message.
     *
     * @return false if the owning session is unknown
     */
    public boolean upsert(Message message) {
        if (!sessionExists.test(message.streamId())) {
            log.warn("Rejected message {}: session {} does not exist", message.id(), message.streamId());
            observer.rejected("message", message.id(), "unknown session " + message.streamId());
            return false;
        }
        Message previous = byId.put(message.id(), message);
        if (previous != null && !previous.streamId().equals(message.streamId())) {
            unindex(previous);
            observer.changed(previous.streamId());
        }
        byStream.computeIfAbsent(message.streamId(), k -> new LinkedHashSet<>()).add(message.id());
        observer.changed(message.streamId());
        return true;
    }

    /**
     * Removes a message and, through the registered hooks, its parts.
     *
     * @return true if the message existed
     */
    public boolean remove(String messageId) {
        Message removed = byId.remove(messageId);
        if (removed == null) {
            return false;
        }
        unindex(removed);
        for (Consumer<Message> hook : deleteHooks) {
            hook.accept(removed);
        }
        observer.changed(removed.streamId());
        return true;
    }

    /**
     * Removes every message of a stream.
     *
     * @return the number of messages removed
     */
    public int removeByStream(String streamId) {
        Set<String> ids = byStream.get(streamId);
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

    public Optional<Message> getById(String messageId) {
        return Optional.ofNullable(byId.get(messageId));
    }

    public boolean contains(String messageId) {
        return byId.containsKey(messageId);
    }

    public List<Message> byStream(String streamId) {
        Set<String> ids = byStream.get(streamId);
        if (ids == null) {
            return List.of();
        }
        return ids.stream().map(byId::get).toList();
    }

    public List<Message> optimisticByStream(String streamId) {
        return byStream(streamId).stream().filter(Message::isOptimistic).toList();
    }

    public int size() {
        return byId.size();
    }

    private void unindex(Message message) {
        Set<String> ids = byStream.get(message.streamId());
        if (ids != null) {
            ids.remove(message.id());
            if (ids.isEmpty()) {
                byStream.remove(message.streamId());
            }
        }
    }
}
