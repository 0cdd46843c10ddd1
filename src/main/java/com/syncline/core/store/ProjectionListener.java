package com.syncline.core.store;

/**
 * Observer of the {@link Projection}. Called once per completed batch, after the write lock has
 * been released.
 */
@FunctionalInterface
public interface ProjectionListener {

    void onChange(ProjectionChange change);

    /** Called immediately, from inside the batch, when a store refuses a write. */
    default void onRejected(String store, String entityId, String reason) {
    }
}
