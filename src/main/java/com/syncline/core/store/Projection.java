package com.syncline.core.store;

import com.syncline.core.model.Message;
import com.syncline.core.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The client-side projection: session, message and part stores wired together.
 * <p>
 * Writes happen inside {@link #batch(Runnable)}, which holds the write lock so readers never see a
 * half-applied batch. When the outermost batch completes, listeners are notified once with the
 * streams it touched. Mutating a store outside a batch fails with {@link IllegalStateException}.
 */
public final class Projection {

    private static final Logger log = LoggerFactory.getLogger(Projection.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<ProjectionListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by the write lock
    private final Set<String> touched = new LinkedHashSet<>();
    private int depth;

    private final SessionStore sessions;
    private final MessageStore messages;
    private final PartStore parts;

    private Projection() {
        StoreObserver observer = new StoreObserver() {
            @Override
            public void changed(String streamId) {
                requireBatch();
                if (streamId != null) {
                    touched.add(streamId);
                }
            }

            @Override
            public void rejected(String store, String entityId, String reason) {
                for (ProjectionListener listener : listeners) {
                    try {
                        listener.onRejected(store, entityId, reason);
                    } catch (RuntimeException e) {
                        log.warn("Projection listener failed on rejection: {}", e.getMessage(), e);
                    }
                }
            }
        };
        this.sessions = new SessionStore(observer);
        this.messages = new MessageStore(sessions::contains, observer);
        this.parts = new PartStore(messages::contains, observer);
    }

    /**
     * Builds the stores and registers the cascades: removing a session removes its messages,
     * removing a message removes its parts.
     */
    public static Projection create() {
        Projection projection = new Projection();
        projection.sessions.onDelete((Session s) -> projection.messages.removeByStream(s.id()));
        projection.messages.onDelete((Message m) -> projection.parts.removeByMessage(m.id()));
        return projection;
    }

    public void addListener(ProjectionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ProjectionListener listener) {
        listeners.remove(listener);
    }

    public SessionStore sessions() {
        return sessions;
    }

    public MessageStore messages() {
        return messages;
    }

    public PartStore parts() {
        return parts;
    }

    public void batch(Runnable work) {
        batch(() -> {
            work.run();
            return null;
        });
    }

    /**
     * Runs {@code work} under the write lock. Nested calls join the enclosing batch.
     */
    public <T> T batch(Supplier<T> work) {
        Set<String> changed = Set.of();
        lock.writeLock().lock();
        try {
            depth++;
            try {
                return work.get();
            } finally {
                depth--;
                if (depth == 0 && !touched.isEmpty()) {
                    changed = new LinkedHashSet<>(touched);
                    touched.clear();
                }
            }
        } finally {
            lock.writeLock().unlock();
            if (!changed.isEmpty() && !lock.isWriteLockedByCurrentThread()) {
                notifyListeners(new ProjectionChange(changed));
            }
        }
    }

    /**
     * Runs {@code reader} under the read lock.
     */
    public <T> T read(Function<Projection, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(this);
        } finally {
            lock.readLock().unlock();
        }
    }

    public StreamSnapshot snapshot(String streamId) {
        return read(p -> new StreamSnapshot(
                sessions.getById(streamId).orElse(null),
                sessions.status(streamId).orElse(null),
                messages.byStream(streamId).stream()
                        .map(m -> new StreamSnapshot.MessageView(m, parts.byMessage(m.id())))
                        .toList()));
    }

    private void requireBatch() {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Projection stores must be mutated inside batch()");
        }
    }

    private void notifyListeners(ProjectionChange change) {
        for (ProjectionListener listener : listeners) {
            try {
                listener.onChange(change);
            } catch (RuntimeException e) {
                log.warn("Projection listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
