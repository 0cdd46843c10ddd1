package com.syncline.core.dispatch;

import java.util.Locale;

/**
 * What happened to one dispatched envelope.
 *
 * @param outcome  pipeline stage that decided the envelope's fate
 * @param released envelopes applied as a consequence (may include previously queued ones)
 * @param error    validation error, for {@link Outcome#INVALID}
 */
public record DispatchResult(Outcome outcome, int released, String error) {

    public enum Outcome {
        APPLIED, QUEUED, INVALID, DUPLICATE, STALE;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static DispatchResult applied(int released) {
        return new DispatchResult(Outcome.APPLIED, released, null);
    }

    public static DispatchResult queued() {
        return new DispatchResult(Outcome.QUEUED, 0, null);
    }

    public static DispatchResult invalid(String error) {
        return new DispatchResult(Outcome.INVALID, 0, error);
    }

    public static DispatchResult duplicate() {
        return new DispatchResult(Outcome.DUPLICATE, 0, null);
    }

    public static DispatchResult stale() {
        return new DispatchResult(Outcome.STALE, 0, null);
    }
}
