package com.syncline.core.dispatch;

import com.syncline.core.events.EventEnvelope;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes envelopes to the handler registered for their type.
 */
@Component
public class EventRouter {

    private final Map<String, EventHandler> handlers = new HashMap<>();

    public EventRouter(List<EventHandler> handlers) {
        for (EventHandler handler : handlers) {
            for (String type : handler.eventTypes()) {
                EventHandler previous = this.handlers.putIfAbsent(type, handler);
                if (previous != null) {
                    throw new IllegalStateException("Event type " + type + " handled by both "
                            + previous.getClass().getSimpleName() + " and "
                            + handler.getClass().getSimpleName());
                }
            }
        }
    }

    public Optional<EventHandler> handlerFor(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Set<String> routedTypes() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * Applies the envelope with its handler.
     *
     * @return false if no handler is registered for the type
     */
    public boolean route(EventEnvelope envelope) {
        EventHandler handler = handlers.get(envelope.type());
        if (handler == null) {
            return false;
        }
        handler.handle(envelope);
        return true;
    }
}
