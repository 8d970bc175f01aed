package com.taskboard.task.domain;

import java.util.Comparator;

/**
 * The ordered list a task belongs to: the subtasks of a parent, or the top-level tasks of a category.
 * Exactly one of the two ids is set. Top-level tasks without a category have no scope ({@code null}).
 */
public record TaskScope(Long categoryId, Long parentTaskId) implements Comparable<TaskScope> {

    // category scopes are locked before parent scopes, each by id
    private static final Comparator<TaskScope> LOCK_ORDER = Comparator
            .comparing(TaskScope::isSubtaskScope)
            .thenComparing(TaskScope::ownerId);

    public static TaskScope ofCategory(Long categoryId) {
        return new TaskScope(categoryId, null);
    }

    public static TaskScope ofParent(Long parentTaskId) {
        return new TaskScope(null, parentTaskId);
    }

    /**
     * Scope of a task with the given category and parent, or {@code null} when it is unscoped.
     */
    public static TaskScope of(Long categoryId, Long parentTaskId) {
        if (parentTaskId != null) {
            return ofParent(parentTaskId);
        }
        return categoryId == null ? null : ofCategory(categoryId);
    }

    public static TaskScope of(Task task) {
        return of(task.getCategory() == null ? null : task.getCategory().getId(),
                task.getParentTask() == null ? null : task.getParentTask().getId());
    }

    public boolean isSubtaskScope() {
        return parentTaskId != null;
    }

    public Long ownerId() {
        return isSubtaskScope() ? parentTaskId : categoryId;
    }

    @Override
    public int compareTo(TaskScope other) {
        return LOCK_ORDER.compare(this, other);
    }
}
