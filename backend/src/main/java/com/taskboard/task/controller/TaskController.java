package com.taskboard.task.controller;

import com.taskboard.common.controller.WorkspaceIdResolver;
import com.taskboard.common.dto.MessageResponse;
import com.taskboard.task.domain.TaskPriority;
import com.taskboard.task.domain.TaskStatus;
import com.taskboard.task.dto.TaskCreateRequest;
import com.taskboard.task.dto.TaskPositionRequest;
import com.taskboard.task.dto.TaskReorderRequest;
import com.taskboard.task.dto.TaskResponse;
import com.taskboard.task.dto.TaskSearchCondition;
import com.taskboard.task.dto.TaskUpdateRequest;
import com.taskboard.task.service.TaskService;
import com.taskboard.user.domain.User;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.taskboard.common.controller.ResponseHelper.created;
import static com.taskboard.common.controller.ResponseHelper.ok;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService taskService;

    @GetMapping
    public ResponseEntity<List<TaskResponse>> getTasks(
            @RequestParam(required = false) Long workspaceId,
            @RequestParam(required = false) Long categoryId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String priority,
            @RequestParam(required = false) List<Long> assigneeIds,
            @RequestParam(required = false) String search,
            @AuthenticationPrincipal User user) {
        TaskSearchCondition condition = TaskSearchCondition.builder()
                .categoryId(categoryId)
                .status(status == null ? null : TaskStatus.fromValue(status))
                .priority(priority == null ? null : TaskPriority.fromValue(priority))
                .assigneeIds(assigneeIds)
                .search(search)
                .build();
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, null);
        return ok(taskService.getTasks(user.getId(), resolved, condition));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(
            @PathVariable Long taskId,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, null);
        return ok(taskService.getTask(user.getId(), resolved, taskId));
    }

    @GetMapping("/{taskId}/subtasks")
    public ResponseEntity<List<TaskResponse>> getSubtasks(
            @PathVariable Long taskId,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, null);
        return ok(taskService.getSubtasks(user.getId(), resolved, taskId));
    }

    @PostMapping
    public ResponseEntity<TaskResponse> createTask(
            @Valid @RequestBody TaskCreateRequest request,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, request.getWorkspaceId());
        return created(taskService.createTask(user, resolved, request));
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<TaskResponse> updateTask(
            @PathVariable Long taskId,
            @Valid @RequestBody TaskUpdateRequest request,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, request.getWorkspaceId());
        return ok(taskService.updateTask(user, resolved, taskId, request));
    }

    @PatchMapping("/{taskId}/position")
    public ResponseEntity<TaskResponse> moveTask(
            @PathVariable Long taskId,
            @Valid @RequestBody TaskPositionRequest request,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, request.getWorkspaceId());
        return ok(taskService.moveTask(user.getId(), resolved, taskId, request));
    }

    @PatchMapping("/reorder")
    public ResponseEntity<List<TaskResponse>> reorderTasks(
            @Valid @RequestBody TaskReorderRequest request,
            @AuthenticationPrincipal User user) {
        return ok(taskService.reorderTasks(user.getId(), request.getTaskIds()));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<MessageResponse> deleteTask(
            @PathVariable Long taskId,
            @RequestParam(required = false) Long workspaceId,
            @AuthenticationPrincipal User user) {
        Long resolved = WorkspaceIdResolver.resolve(workspaceId, null);
        taskService.deleteTask(user.getId(), resolved, taskId);
        return ok(new MessageResponse("Task deleted successfully"));
    }
}
