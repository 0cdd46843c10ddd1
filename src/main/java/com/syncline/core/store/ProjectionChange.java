package com.syncline.core.store;

import java.util.Set;

/**
 * Streams touched by one completed projection batch.
 */
public record ProjectionChange(Set<String> streamIds) {

    public ProjectionChange {
        streamIds = Set.copyOf(streamIds);
    }
}
