package com.taskboard.task.dto;

import com.taskboard.task.domain.Task;
import com.taskboard.task.domain.TaskPriority;
import com.taskboard.task.domain.TaskStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskCreateRequest {

    private Long workspaceId;

    @NotBlank(message = "Task title is required")
    @Size(max = Task.MAX_TITLE_LENGTH, message = "Task title must be 500 characters or less")
    private String title;

    private String description;

    private Long categoryId;

    private Long parentTaskId;

    private TaskPriority priority;

    private TaskStatus status;

    private LocalDate dueDate;

    private List<Long> assigneeIds;
}
