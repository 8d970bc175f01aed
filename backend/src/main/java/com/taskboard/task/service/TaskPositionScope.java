package com.taskboard.task.service;

import com.taskboard.category.repository.CategoryRepository;
import com.taskboard.common.position.PositionScope;
import com.taskboard.exception.CategoryNotFoundException;
import com.taskboard.exception.TaskNotFoundException;
import com.taskboard.task.domain.TaskScope;
import com.taskboard.task.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Top-level tasks are ordered per category (locked through the category row),
 * subtasks per parent (locked through the parent task row).
 */
@Component
@RequiredArgsConstructor
public class TaskPositionScope implements PositionScope<TaskScope> {

    private static final long NO_ID = -1L;

    private final TaskRepository taskRepository;
    private final CategoryRepository categoryRepository;

    @Override
    public void lock(TaskScope scope) {
        if (scope.isSubtaskScope()) {
            taskRepository.findByIdForUpdate(scope.parentTaskId())
                    .orElseThrow(() -> new TaskNotFoundException("Task not found with id: " + scope.parentTaskId()));
        } else {
            categoryRepository.findByIdForUpdate(scope.categoryId())
                    .orElseThrow(() -> new CategoryNotFoundException("Category not found with id: " + scope.categoryId()));
        }
    }

    @Override
    public int maxPosition(TaskScope scope) {
        return scope.isSubtaskScope()
                ? taskRepository.findMaxPositionInParent(scope.parentTaskId())
                : taskRepository.findMaxPositionInCategory(scope.categoryId());
    }

    @Override
    public long countExcluding(TaskScope scope, Long excludedId) {
        return scope.isSubtaskScope()
                ? taskRepository.countInParentExcluding(scope.parentTaskId(), orNone(excludedId))
                : taskRepository.countInCategoryExcluding(scope.categoryId(), orNone(excludedId));
    }

    @Override
    public void shiftUp(TaskScope scope, int fromInclusive, Long excludedId) {
        if (scope.isSubtaskScope()) {
            taskRepository.shiftUpInParent(scope.parentTaskId(), fromInclusive, orNone(excludedId));
        } else {
            taskRepository.shiftUpInCategory(scope.categoryId(), fromInclusive, orNone(excludedId));
        }
    }

    @Override
    public void shiftDown(TaskScope scope, int afterExclusive, Long excludedId) {
        if (scope.isSubtaskScope()) {
            taskRepository.shiftDownInParent(scope.parentTaskId(), afterExclusive, orNone(excludedId));
        } else {
            taskRepository.shiftDownInCategory(scope.categoryId(), afterExclusive, orNone(excludedId));
        }
    }

    @Override
    public void place(Long id, TaskScope scope, int position) {
        if (scope == null) {
            taskRepository.detachFromCategory(id);
        } else if (scope.isSubtaskScope()) {
            taskRepository.updatePosition(id, position);
        } else {
            taskRepository.placeInCategory(id, categoryRepository.getReferenceById(scope.categoryId()), position);
        }
    }

    @Override
    public List<Long> idsInScope(TaskScope scope) {
        return scope.isSubtaskScope()
                ? taskRepository.findIdsInParent(scope.parentTaskId())
                : taskRepository.findIdsInCategory(scope.categoryId());
    }

    @Override
    public String scopeName(TaskScope scope) {
        return scope != null && scope.isSubtaskScope() ? "parent" : "category";
    }

    private static Long orNone(Long id) {
        return id == null ? NO_ID : id;
    }
}
