package com.taskboard.common.position;

import com.taskboard.exception.InvalidRequestException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps positions dense (0..N-1) inside each scope of an ordered collection.
 * <p>
 * Every operation joins the caller's transaction and locks the scopes it touches,
 * in key order, before reading any position.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderedCollectionManager {

    private final MeterRegistry meterRegistry;

    /**
     * Position for a new entity appended to the end of {@code key}. Unscoped entities get 0.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public <K extends Comparable<K>> int appendPosition(PositionScope<K> scope, K key) {
        if (key == null) {
            return 0;
        }
        scope.lock(key);
        return scope.maxPosition(key) + 1;
    }

    /**
     * Moves an entity to {@code targetIndex} within {@code targetKey}, which may equal {@code sourceKey}.
     *
     * @return the position actually written, after clamping to the end of the target scope
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public <K extends Comparable<K>> int move(PositionScope<K> scope, Long id,
                                              K sourceKey, int sourcePosition,
                                              K targetKey, int targetIndex) {
        if (targetIndex < 0) {
            throw new InvalidRequestException("Position must be a non-negative integer");
        }
        lockInOrder(scope, sourceKey, targetKey);

        int position;
        if (Objects.equals(sourceKey, targetKey)) {
            position = moveWithinScope(scope, id, sourceKey, sourcePosition, targetIndex);
        } else {
            position = moveAcrossScopes(scope, id, sourceKey, sourcePosition, targetKey, targetIndex);
        }

        meterRegistry.counter("taskboard.positions.moves", "scope", scope.scopeName(targetKey)).increment();
        log.debug("Moved {} item id={} from {}@{} to {}@{}",
                scope.scopeName(targetKey), id, sourceKey, sourcePosition, targetKey, position);
        return position;
    }

    /**
     * Runs {@code deletion} under the scope lock, then closes the gap the removed entity leaves at
     * {@code removedPosition}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public <K extends Comparable<K>> void remove(PositionScope<K> scope, K key, int removedPosition,
                                                 Runnable deletion) {
        if (key == null) {
            deletion.run();
            return;
        }
        scope.lock(key);
        deletion.run();
        scope.shiftDown(key, removedPosition, null);
    }

    /**
     * Rewrites positions so that {@code orderedIds.get(i)} ends up at position i.
     * The list must name every entity of the scope exactly once.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public <K extends Comparable<K>> void reorder(PositionScope<K> scope, K key, List<Long> orderedIds) {
        if (key == null) {
            throw new InvalidRequestException("Cannot reorder items that have no " + scope.scopeName(null));
        }
        Set<Long> requested = new HashSet<>(orderedIds);
        if (requested.size() != orderedIds.size()) {
            throw new InvalidRequestException("Reorder list contains duplicate ids");
        }

        scope.lock(key);
        Set<Long> current = new HashSet<>(scope.idsInScope(key));
        if (!current.equals(requested)) {
            throw new InvalidRequestException("Reorder list must contain every item in the "
                    + scope.scopeName(key) + " exactly once");
        }

        for (int i = 0; i < orderedIds.size(); i++) {
            scope.place(orderedIds.get(i), key, i);
        }
        log.debug("Reordered {} {}: {}", scope.scopeName(key), key, orderedIds);
    }

    private <K extends Comparable<K>> int moveWithinScope(PositionScope<K> scope, Long id, K key,
                                                          int sourcePosition, int targetIndex) {
        if (key == null) {
            scope.place(id, null, 0);
            return 0;
        }
        int position = clamp(targetIndex, scope.countExcluding(key, id));
        if (position == sourcePosition) {
            return position;
        }
        scope.shiftDown(key, sourcePosition, id);
        scope.shiftUp(key, position, id);
        scope.place(id, key, position);
        return position;
    }

    private <K extends Comparable<K>> int moveAcrossScopes(PositionScope<K> scope, Long id,
                                                           K sourceKey, int sourcePosition,
                                                           K targetKey, int targetIndex) {
        int position = targetKey == null ? 0 : clamp(targetIndex, scope.countExcluding(targetKey, id));

        scope.place(id, targetKey, position);
        if (targetKey != null) {
            scope.shiftUp(targetKey, position, id);
        }
        if (sourceKey != null) {
            scope.shiftDown(sourceKey, sourcePosition, id);
        }
        return position;
    }

    private <K extends Comparable<K>> void lockInOrder(PositionScope<K> scope, K first, K second) {
        Stream.of(first, second)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .collect(Collectors.toList())
                .forEach(scope::lock);
    }

    private int clamp(int index, long size) {
        return (int) Math.min(index, size);
    }
}
