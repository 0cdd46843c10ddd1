package com.syncline.core.store;

import com.syncline.core.model.Session;
import com.syncline.core.model.SessionStatus;
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

/**
 * Sessions keyed by id, indexed by directory, plus the current {@link SessionStatus} of each.
 * <p>
 * Not thread-safe on its own; {@link Projection} guards access.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<String, Session> byId = new LinkedHashMap<>();
    private final Map<String, SessionStatus> statuses = new LinkedHashMap<>();
    private final Map<String, Set<String>> byDirectory = new LinkedHashMap<>();
    private final List<Consumer<Session>> deleteHooks = new ArrayList<>();
    private final StoreObserver observer;

    public SessionStore(StoreObserver observer) {
        this.observer = observer;
    }

    /** Registers a hook run after a session has been removed. */
    public void onDelete(Consumer<Session> hook) {
        deleteHooks.add(hook);
    }

    public boolean upsert(Session session) {
        Session previous = byId.put(session.id(), session);
        if (previous != null && !previous.directory().equals(session.directory())) {
            unindex(previous);
        }
        byDirectory.computeIfAbsent(session.directory(), k -> new LinkedHashSet<>()).add(session.id());
        observer.changed(session.id());
        return true;
    }

    /**
     * Returns the session, creating it in {@code directory} when unknown.
     */
    public Session getOrCreate(String sessionId, String directory) {
        Session existing = byId.get(sessionId);
        if (existing != null) {
            return existing;
        }
        Session created = new Session(sessionId, directory);
        upsert(created);
        log.debug("Created session {} lazily in directory {}", sessionId, created.directory());
        return created;
    }

    /**
     * Removes a session and, through the registered hooks, everything it owns.
     *
     * @return true if the session existed
     */
    public boolean remove(String sessionId) {
        Session removed = byId.remove(sessionId);
        if (removed == null) {
            return false;
        }
        unindex(removed);
        statuses.remove(sessionId);
        for (Consumer<Session> hook : deleteHooks) {
            hook.accept(removed);
        }
        observer.changed(sessionId);
        log.debug("Removed session {}", sessionId);
        return true;
    }

    public Optional<Session> getById(String sessionId) {
        return Optional.ofNullable(byId.get(sessionId));
    }

    public boolean contains(String sessionId) {
        return byId.containsKey(sessionId);
    }

    public List<Session> byDirectory(String directory) {
        Set<String> ids = byDirectory.get(directory);
        if (ids == null) {
            return List.of();
        }
        return ids.stream().map(byId::get).toList();
    }

    public List<Session> all() {
        return List.copyOf(byId.values());
    }

    /**
     * Sets the status of a known session.
     *
     * @return false if the session does not exist
     */
    public boolean setStatus(String sessionId, SessionStatus status) {
        if (!byId.containsKey(sessionId)) {
            log.warn("Rejected status for unknown session {}", sessionId);
            observer.rejected("session", sessionId, "unknown session");
            return false;
        }
        statuses.put(sessionId, status);
        observer.changed(sessionId);
        return true;
    }

    public Optional<SessionStatus> status(String sessionId) {
        return Optional.ofNullable(statuses.get(sessionId));
    }

    public int size() {
        return byId.size();
    }

    private void unindex(Session session) {
        Set<String> ids = byDirectory.get(session.directory());
        if (ids != null) {
            ids.remove(session.id());
            if (ids.isEmpty()) {
                byDirectory.remove(session.directory());
            }
        }
    }
}
