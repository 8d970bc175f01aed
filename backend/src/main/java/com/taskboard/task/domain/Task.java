package com.taskboard.task.domain;

import com.taskboard.category.domain.Category;
import com.taskboard.user.domain.User;
import com.taskboard.workspace.domain.Workspace;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A task or, when {@code parentTask} is set, a subtask. Subtasks never carry a category
 * and are ordered among their siblings.
 */
@Entity
@Table(name = "tasks")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Task {

    public static final int MAX_TITLE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workspace_id", nullable = false)
    private Workspace workspace;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private Category category;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_task_id")
    private Task parentTask;

    @Column(nullable = false, length = MAX_TITLE_LENGTH)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, length = 20)
    private TaskPriority priority;

    @Column(nullable = false, length = 20)
    private TaskStatus status;

    private LocalDate dueDate;

    private LocalDateTime completedAt;

    @Column(nullable = false)
    private int position;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by")
    private User createdBy;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "task_assignments",
            joinColumns = @JoinColumn(name = "task_id"),
            inverseJoinColumns = @JoinColumn(name = "user_id"))
    private Set<User> assignees = new LinkedHashSet<>();

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    @Builder
    public Task(Workspace workspace, Category category, Task parentTask, String title, String description,
                TaskPriority priority, TaskStatus status, LocalDate dueDate, int position, User createdBy,
                Set<User> assignees) {
        this.workspace = workspace;
        this.category = parentTask == null ? category : null;
        this.parentTask = parentTask;
        this.title = title;
        this.description = description;
        this.priority = priority == null ? TaskPriority.MEDIUM : priority;
        this.status = TaskStatus.TODO;
        this.dueDate = dueDate;
        this.position = position;
        this.createdBy = createdBy;
        if (assignees != null) {
            this.assignees.addAll(assignees);
        }
        changeStatus(status == null ? TaskStatus.TODO : status);
    }

    public boolean isSubtask() {
        return parentTask != null;
    }

    /**
     * completedAt is set on the transition into COMPLETED and cleared on the transition out of it.
     */
    public void changeStatus(TaskStatus newStatus) {
        if (newStatus == TaskStatus.COMPLETED && (status != TaskStatus.COMPLETED || completedAt == null)) {
            completedAt = LocalDateTime.now();
        } else if (newStatus != TaskStatus.COMPLETED) {
            completedAt = null;
        }
        status = newStatus;
    }

    public void changeTitle(String title) {
        this.title = title;
    }

    public void changeDescription(String description) {
        this.description = description;
    }

    public void changePriority(TaskPriority priority) {
        this.priority = priority;
    }

    public void changeDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    /**
     * Replaces the assignee set.
     *
     * @return ids of users that were not assigned before
     */
    public Set<Long> replaceAssignees(Set<User> newAssignees) {
        Set<Long> previous = assignees.stream().map(User::getId).collect(Collectors.toSet());
        assignees.clear();
        assignees.addAll(newAssignees);
        Set<Long> added = new HashSet<>();
        for (User user : newAssignees) {
            if (!previous.contains(user.getId())) {
                added.add(user.getId());
            }
        }
        return added;
    }
}
