package com.syncline.core.events;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Map;

/**
 * One server-originated event carrying identity and ordering metadata.
 *
 * @param type       event type (e.g. "message.updated", "session.status")
 * @param properties type-specific payload
 * @param eventId    globally unique, time-sortable event id
 * @param sequence   monotonic sequence number within {@code streamId}
 * @param timestamp  epoch millis at which the server emitted the event
 * @param streamId   stream (session) the event belongs to; absent for server-level events
 * @param directory  workspace directory, if the server supplied one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope(
    String type,
    Map<String, Object> properties,
    String eventId,
    Long sequence,
    Long timestamp,
    @JsonAlias({"sessionID", "sessionId"}) String streamId,
    String directory
) implements Serializable {

    /** True when the envelope can take part in per-stream ordering. */
    @JsonIgnore
    public boolean isOrdered() {
        return streamId != null && sequence != null;
    }

    /** Reads a string property, or {@code null} when absent or not a string. */
    public String stringProperty(String key) {
        if (properties == null) {
            return null;
        }
        return properties.get(key) instanceof String s ? s : null;
    }
}
