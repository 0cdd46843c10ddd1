package com.syncline.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Execution status of a session.
 *
 * @param type    idle, busy or retry
 * @param attempt retry attempt number (retry only)
 * @param message retry reason (retry only)
 * @param next    epoch millis of the next attempt (retry only)
 */
public record SessionStatus(
    Type type,
    Integer attempt,
    String message,
    Long next
) implements Serializable {

    public enum Type { IDLE, BUSY, RETRY }

    public static SessionStatus idle() {
        return new SessionStatus(Type.IDLE, null, null, null);
    }

    public static SessionStatus busy() {
        return new SessionStatus(Type.BUSY, null, null, null);
    }

    public static SessionStatus retry(int attempt, String message, long next) {
        return new SessionStatus(Type.RETRY, attempt, message, next);
    }

    /**
     * Parses a wire status. Accepts the legacy string forms ({@code "idle"}, {@code "running"},
     * {@code "error"}) and the object form ({@code {"type": "retry", "attempt": 1, ...}}).
     *
     * @return the status, or {@code null} when the value is not a recognizable status
     */
    public static SessionStatus parse(Object raw) {
        if (raw instanceof String s) {
            return switch (s) {
                case "idle", "error" -> idle();
                case "running", "busy" -> busy();
                default -> null;
            };
        }
        if (!(raw instanceof Map<?, ?> map) || !(map.get("type") instanceof String type)) {
            return null;
        }
        switch (type) {
            case "idle":
                return idle();
            case "busy":
                return busy();
            case "retry":
                if (map.get("attempt") instanceof Number attempt
                        && map.get("message") instanceof String message
                        && map.get("next") instanceof Number next) {
                    return retry(attempt.intValue(), message, next.longValue());
                }
                return null;
            default:
                return null;
        }
    }
}
