package com.syncline.core.dispatch;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Wire shape of {@code session.created}/{@code session.updated} {@code properties.info}.
 * Either {@code sessionId} or {@code id} names the session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionInfoPayload(String id, @JsonAlias("sessionID") String sessionId, String directory) {

    public String resolvedId() {
        return sessionId != null ? sessionId : id;
    }
}
