package com.syncline.core.logging;

import com.syncline.core.events.EventEnvelope;
import org.slf4j.MDC;

/**
 * Utility for managing Syncline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setStream(String streamId) {
        if (streamId != null) {
            MDC.put("streamId", streamId);
        }
    }

    public static void setEvent(EventEnvelope envelope) {
        setStream(envelope.streamId());
        if (envelope.eventId() != null) {
            MDC.put("eventId", envelope.eventId());
        }
        if (envelope.type() != null) {
            MDC.put("eventType", envelope.type());
        }
    }

    public static void clear() {
        MDC.remove("streamId");
        MDC.remove("eventId");
        MDC.remove("eventType");
    }
}
