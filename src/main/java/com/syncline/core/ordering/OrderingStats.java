package com.syncline.core.ordering;

/**
 * Snapshot of one stream's ordering state.
 *
 * @param queueSize     envelopes waiting for a gap to close
 * @param lastProcessed highest sequence released so far
 * @param nextExpected  sequence that would release immediately
 * @param oldestQueued  lowest queued sequence, or {@code null} when the queue is empty
 */
public record OrderingStats(int queueSize, long lastProcessed, long nextExpected, Long oldestQueued) {}
