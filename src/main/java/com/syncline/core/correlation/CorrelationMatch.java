package com.syncline.core.correlation;

/**
 * Transient result of matching a canonical entity against optimistic candidates.
 *
 * @param entity     the optimistic entity that matched
 * @param confidence match strength
 * @param strategy   label of the rule that matched, for diagnostics and metrics
 */
public record CorrelationMatch<T>(T entity, MatchConfidence confidence, String strategy) {}
