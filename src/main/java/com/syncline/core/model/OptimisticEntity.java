package com.syncline.core.model;

/**
 * An entity that may have been created optimistically.
 */
public interface OptimisticEntity {

    String id();

    /** Optimistic metadata, or {@code null} for canonical entities. */
    OptimisticMetadata optimisticMetadata();

    default boolean isOptimistic() {
        return optimisticMetadata() != null;
    }
}
