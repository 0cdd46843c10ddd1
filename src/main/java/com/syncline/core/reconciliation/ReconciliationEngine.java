package com.syncline.core.reconciliation;

import com.syncline.core.correlation.CorrelationMatch;
import com.syncline.core.correlation.CorrelationMatcher;
import com.syncline.core.model.Message;
import com.syncline.core.model.OptimisticEntity;
import com.syncline.core.model.Part;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Applies {@link CorrelationMatcher} over whole collections.
 * <p>
 * Canonical data always wins: every canonical entity is upserted as-is (minus optimistic
 * metadata) whether or not it matched. Each optimistic entity is consumed by at most one
 * canonical entity, the first one that matches it. Unmatched optimistic entities are left alone.
 */
public class ReconciliationEngine {

    private final CorrelationMatcher matcher;
    private final Clock clock;

    public ReconciliationEngine(CorrelationMatcher matcher, Clock clock) {
        this.matcher = matcher;
        this.clock = clock;
    }

    public CorrelationMatcher matcher() {
        return matcher;
    }

    public ReconciliationResult<Message> reconcileMessages(List<Message> canonical, List<Message> optimistic) {
        return reconcile(canonical, optimistic, matcher::findMatchingMessage, Message::asCanonical);
    }

    public ReconciliationResult<Part> reconcileParts(List<Part> canonical, List<Part> optimistic) {
        return reconcile(canonical, optimistic, matcher::findMatchingPart, Part::asCanonical);
    }

    /**
     * Ids of optimistic entities older than the correlation window.
     */
    public List<String> findOrphanedOptimisticEntities(Collection<? extends OptimisticEntity> entities) {
        return findOrphanedOptimisticEntities(entities, matcher.windowMs());
    }

    /**
     * Ids of optimistic entities created more than {@code maxAgeMs} ago. Such entities never
     * received a canonical counterpart (e.g. the request failed) and can be removed.
     */
    public List<String> findOrphanedOptimisticEntities(Collection<? extends OptimisticEntity> entities,
                                                       long maxAgeMs) {
        long now = clock.millis();
        List<String> orphaned = new ArrayList<>();
        for (OptimisticEntity entity : entities) {
            if (entity.isOptimistic() && now - entity.optimisticMetadata().timestamp() > maxAgeMs) {
                orphaned.add(entity.id());
            }
        }
        return orphaned;
    }

    private <T extends OptimisticEntity> ReconciliationResult<T> reconcile(
            List<T> canonical,
            List<T> optimistic,
            BiFunction<List<T>, T, Optional<CorrelationMatch<T>>> finder,
            UnaryOperator<T> toCanonical) {

        List<T> candidates = new ArrayList<>();
        for (T entity : optimistic) {
            if (entity.isOptimistic()) {
                candidates.add(entity);
            }
        }

        List<T> toUpsert = new ArrayList<>(canonical.size());
        List<String> toRemove = new ArrayList<>();
        List<CorrelationMatch<T>> matches = new ArrayList<>();
        Set<String> matchedIds = new HashSet<>();
        Map<String, Integer> strategyCounts = new LinkedHashMap<>();

        for (T entity : canonical) {
            Optional<CorrelationMatch<T>> match = finder.apply(candidates, entity);
            if (match.isPresent()) {
                T consumed = match.get().entity();
                candidates.remove(consumed);
                matchedIds.add(consumed.id());
                toRemove.add(consumed.id());
                matches.add(match.get());
                strategyCounts.merge(match.get().strategy(), 1, Integer::sum);
            }
            toUpsert.add(toCanonical.apply(entity));
        }

        Set<String> staleIds = new HashSet<>(findOrphanedOptimisticEntities(candidates));
        int unmatched = candidates.size() - staleIds.size();

        var stats = new ReconciliationStats(
                canonical.size(),
                optimistic.size(),
                matchedIds.size(),
                unmatched,
                staleIds.size(),
                Map.copyOf(strategyCounts));
        return new ReconciliationResult<>(toUpsert, toRemove, matches, stats);
    }
}
