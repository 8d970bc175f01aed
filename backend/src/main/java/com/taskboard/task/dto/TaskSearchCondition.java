package com.taskboard.task.dto;

import com.taskboard.task.domain.TaskPriority;
import com.taskboard.task.domain.TaskStatus;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class TaskSearchCondition {
    private Long categoryId;
    private TaskStatus status;
    private TaskPriority priority;
    // any-of match
    private List<Long> assigneeIds;
    private String search;
}
