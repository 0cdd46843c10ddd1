package com.syncline.core.dispatch;

import com.syncline.core.events.EventEnvelope;

import java.util.Set;

/**
 * Applies envelopes of specific types to the projection. Called inside a projection batch.
 */
public interface EventHandler {

    Set<String> eventTypes();

    void handle(EventEnvelope envelope);
}
