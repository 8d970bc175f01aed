package com.taskboard.task.dto;

import com.taskboard.task.domain.TaskPriority;
import com.taskboard.task.domain.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {
    private Long id;
    private Long workspaceId;
    private Long categoryId;
    private Long parentTaskId;
    private String title;
    private String description;
    private TaskPriority priority;
    private TaskStatus status;
    private LocalDate dueDate;
    private LocalDateTime completedAt;
    private int position;
    private Long createdBy;
    private List<AssigneeResponse> assignees;
    private long subtaskCount;
    private long completedSubtaskCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
