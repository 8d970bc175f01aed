package com.taskboard.task.event;

import java.util.Set;

/**
 * Published inside the task transaction; delivered to listeners after commit.
 */
public record TaskAssignedEvent(Long taskId, Long workspaceId, String taskTitle,
                                Set<Long> assigneeIds, Long assignedBy) {
}
