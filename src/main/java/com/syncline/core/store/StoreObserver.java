package com.syncline.core.store;

/**
 * Receives mutation and rejection notices from the domain stores.
 */
public interface StoreObserver {

    StoreObserver NONE = streamId -> { };

    /** A record owned by {@code streamId} was written or removed. */
    void changed(String streamId);

    /** A write was refused by a referential-integrity check. */
    default void rejected(String store, String entityId, String reason) {
    }
}
