package com.syncline.core.model;

import java.io.Serializable;

/**
 * A logical event stream. Messages are owned by a session; the session id is the stream id.
 *
 * @param id        session (stream) identifier
 * @param directory workspace directory the session belongs to
 */
public record Session(String id, String directory) implements Serializable {

    public static final String DEFAULT_DIRECTORY = "default";

    public Session {
        if (directory == null || directory.isBlank()) {
            directory = DEFAULT_DIRECTORY;
        }
    }
}
