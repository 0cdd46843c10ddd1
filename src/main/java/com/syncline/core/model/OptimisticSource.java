package com.syncline.core.model;

/**
 * Origin of a locally created (optimistic) entity.
 */
public enum OptimisticSource {
    /** Created when the user submits chat input, before the server acknowledges it. */
    LOCAL_SUBMIT,
    /** Created from another explicit user action (e.g. a tool approval placeholder). */
    USER_ACTION
}
