package com.taskboard.task.mapper;

import com.taskboard.task.domain.Task;
import com.taskboard.task.dto.AssigneeResponse;
import com.taskboard.task.dto.TaskResponse;
import com.taskboard.user.domain.User;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface TaskMapper {

    @Mapping(source = "task.workspace.id", target = "workspaceId")
    @Mapping(source = "task.category.id", target = "categoryId")
    @Mapping(source = "task.parentTask.id", target = "parentTaskId")
    @Mapping(source = "task.createdBy.id", target = "createdBy")
    @Mapping(source = "subtaskCount", target = "subtaskCount")
    @Mapping(source = "completedSubtaskCount", target = "completedSubtaskCount")
    TaskResponse toResponse(Task task, long subtaskCount, long completedSubtaskCount);

    AssigneeResponse toAssignee(User user);
}
