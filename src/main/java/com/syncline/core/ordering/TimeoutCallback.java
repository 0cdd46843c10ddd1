package com.syncline.core.ordering;

/**
 * Invoked when a stream's gap timer fires.
 * <p>
 * The buffer does not drain on its own timer thread: the callback owner is expected to call
 * {@link SequenceOrderingBuffer#forceRelease(String)} from inside its per-stream serialization
 * and apply the result, so a timed-out drain can never interleave with an in-flight batch.
 */
@FunctionalInterface
public interface TimeoutCallback {

    void onTimeout(String streamId);
}
