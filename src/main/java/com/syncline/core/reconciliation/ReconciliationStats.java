package com.syncline.core.reconciliation;

import java.util.Map;

/**
 * Diagnostics of one reconciliation pass.
 *
 * @param totalCanonical  canonical entities considered
 * @param totalOptimistic optimistic candidates supplied
 * @param matched         optimistic entities consumed by a canonical match
 * @param unmatched       optimistic entities neither matched nor stale (still in flight)
 * @param stale           optimistic entities older than the correlation window and unmatched
 * @param strategy        matches per strategy label
 */
public record ReconciliationStats(
    int totalCanonical,
    int totalOptimistic,
    int matched,
    int unmatched,
    int stale,
    Map<String, Integer> strategy
) {}
