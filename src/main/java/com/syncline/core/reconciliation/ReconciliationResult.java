package com.syncline.core.reconciliation;

import com.syncline.core.correlation.CorrelationMatch;

import java.util.List;

/**
 * Mutations produced by reconciling canonical entities with optimistic ones.
 *
 * @param toUpsert canonical entities to write, stripped of optimistic metadata, in input order
 * @param toRemove ids of optimistic entities superseded by a canonical entity
 * @param matches  the match behind each removal, in the same order as {@code toRemove}
 * @param stats    diagnostics
 */
public record ReconciliationResult<T>(
    List<T> toUpsert,
    List<String> toRemove,
    List<CorrelationMatch<T>> matches,
    ReconciliationStats stats
) {}
