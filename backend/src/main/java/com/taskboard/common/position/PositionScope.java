package com.taskboard.common.position;

import java.util.List;

/**
 * Storage adapter for one kind of ordered collection.
 * <p>
 * A key identifies one scope, e.g. a workspace for categories or a category for tasks.
 * Implementations never see a {@code null} key: unscoped entities are handled by
 * {@link OrderedCollectionManager} before reaching the adapter, except in {@link #place}.
 *
 * @param <K> scope key, ordered so that several scopes can be locked deterministically
 */
public interface PositionScope<K extends Comparable<K>> {

    /**
     * Takes a row lock on whatever row owns the scope. Held until the surrounding transaction ends.
     */
    void lock(K key);

    /**
     * Highest position in the scope, or -1 when empty.
     */
    int maxPosition(K key);

    long countExcluding(K key, Long excludedId);

    /**
     * position = position + 1 for every entity in scope with position >= {@code fromInclusive}.
     */
    void shiftUp(K key, int fromInclusive, Long excludedId);

    /**
     * position = position - 1 for every entity in scope with position > {@code afterExclusive}.
     */
    void shiftDown(K key, int afterExclusive, Long excludedId);

    /**
     * Writes the entity's scope and position. {@code key} may be {@code null} for entities leaving every scope.
     */
    void place(Long id, K key, int position);

    List<Long> idsInScope(K key);

    /**
     * Human-readable name of the scope {@code key} belongs to, used in messages, logs and metric tags.
     * {@code key} may be {@code null}.
     */
    String scopeName(K key);
}
