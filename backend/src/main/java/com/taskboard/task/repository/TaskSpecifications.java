package com.taskboard.task.repository;

import com.taskboard.task.domain.Task;
import com.taskboard.task.domain.TaskPriority;
import com.taskboard.task.domain.TaskStatus;
import com.taskboard.task.dto.TaskSearchCondition;
import com.taskboard.user.domain.User;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;

/**
 * Filters for the task list endpoint.
 */
public final class TaskSpecifications {

    private TaskSpecifications() {
    }

    public static Specification<Task> matching(Long workspaceId, TaskSearchCondition condition) {
        return Specification.where(inWorkspace(workspaceId))
                .and(inCategory(condition.getCategoryId()))
                .and(hasStatus(condition.getStatus()))
                .and(hasPriority(condition.getPriority()))
                .and(assignedToAnyOf(condition.getAssigneeIds()))
                .and(containsText(condition.getSearch()));
    }

    public static Specification<Task> inWorkspace(Long workspaceId) {
        return (root, query, cb) -> cb.equal(root.get("workspace").get("id"), workspaceId);
    }

    public static Specification<Task> inCategory(Long categoryId) {
        return (root, query, cb) -> categoryId == null ? null : cb.equal(root.get("category").get("id"), categoryId);
    }

    public static Specification<Task> hasStatus(TaskStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<Task> hasPriority(TaskPriority priority) {
        return (root, query, cb) -> priority == null ? null : cb.equal(root.get("priority"), priority);
    }

    /**
     * EXISTS over task_assignments, so a task assigned to several matching users appears once.
     */
    public static Specification<Task> assignedToAnyOf(List<Long> userIds) {
        return (root, query, cb) -> {
            if (userIds == null || userIds.isEmpty()) {
                return null;
            }
            Subquery<Long> subquery = query.subquery(Long.class);
            Root<Task> assigned = subquery.from(Task.class);
            Join<Task, User> assignee = assigned.join("assignees");
            subquery.select(assigned.get("id"))
                    .where(cb.equal(assigned.get("id"), root.get("id")),
                            assignee.get("id").in(userIds));
            return cb.exists(subquery);
        };
    }

    public static Specification<Task> containsText(String search) {
        return (root, query, cb) -> {
            if (search == null || search.isBlank()) {
                return null;
            }
            String pattern = "%" + search.trim().toLowerCase() + "%";
            return cb.or(
                    cb.like(cb.lower(root.get("title")), pattern),
                    cb.like(cb.lower(root.get("description")), pattern));
        };
    }
}
