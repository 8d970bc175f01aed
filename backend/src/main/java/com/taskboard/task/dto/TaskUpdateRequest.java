package com.taskboard.task.dto;

import com.taskboard.task.domain.Task;
import com.taskboard.task.domain.TaskPriority;
import com.taskboard.task.domain.TaskStatus;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Partial update. Jackson only calls the setters of properties present in the body,
 * so each setter records presence. A present {@code null} clears the nullable fields
 * (description, categoryId, dueDate, assigneeIds).
 */
@NoArgsConstructor
public class TaskUpdateRequest {

    @Getter
    private Long workspaceId;

    @Size(min = 1, max = Task.MAX_TITLE_LENGTH, message = "Task title must be between 1 and 500 characters")
    private String title;
    private boolean titlePresent;

    private String description;
    private boolean descriptionPresent;

    private Long categoryId;
    private boolean categoryIdPresent;

    private TaskPriority priority;
    private boolean priorityPresent;

    private TaskStatus status;
    private boolean statusPresent;

    private LocalDate dueDate;
    private boolean dueDatePresent;

    private List<Long> assigneeIds;
    private boolean assigneeIdsPresent;

    public void setWorkspaceId(Long workspaceId) {
        this.workspaceId = workspaceId;
    }

    public void setTitle(String title) {
        this.title = title;
        this.titlePresent = true;
    }

    public void setDescription(String description) {
        this.description = description;
        this.descriptionPresent = true;
    }

    public void setCategoryId(Long categoryId) {
        this.categoryId = categoryId;
        this.categoryIdPresent = true;
    }

    public void setPriority(TaskPriority priority) {
        this.priority = priority;
        this.priorityPresent = true;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
        this.statusPresent = true;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
        this.dueDatePresent = true;
    }

    public void setAssigneeIds(List<Long> assigneeIds) {
        this.assigneeIds = assigneeIds;
        this.assigneeIdsPresent = true;
    }

    public boolean hasTitle() {
        return titlePresent;
    }

    public boolean hasDescription() {
        return descriptionPresent;
    }

    public boolean hasCategoryId() {
        return categoryIdPresent;
    }

    public boolean hasPriority() {
        return priorityPresent;
    }

    public boolean hasStatus() {
        return statusPresent;
    }

    public boolean hasDueDate() {
        return dueDatePresent;
    }

    public boolean hasAssigneeIds() {
        return assigneeIdsPresent;
    }

    public Optional<String> title() {
        return Optional.ofNullable(title);
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public Optional<Long> categoryId() {
        return Optional.ofNullable(categoryId);
    }

    public Optional<TaskPriority> priority() {
        return Optional.ofNullable(priority);
    }

    public Optional<TaskStatus> status() {
        return Optional.ofNullable(status);
    }

    public Optional<LocalDate> dueDate() {
        return Optional.ofNullable(dueDate);
    }

    public List<Long> assigneeIds() {
        return assigneeIds == null ? List.of() : assigneeIds;
    }
}
