package com.taskboard.task.service;

import com.taskboard.category.domain.Category;
import com.taskboard.category.repository.CategoryRepository;
import com.taskboard.common.position.OrderedCollectionManager;
import com.taskboard.common.service.PermissionService;
import com.taskboard.exception.CategoryNotFoundException;
import com.taskboard.exception.InvalidRequestException;
import com.taskboard.exception.MixedScopeReorderException;
import com.taskboard.exception.TaskNotFoundException;
import com.taskboard.task.domain.Task;
import com.taskboard.task.domain.TaskScope;
import com.taskboard.task.domain.TaskStatus;
import com.taskboard.task.dto.TaskCreateRequest;
import com.taskboard.task.dto.TaskPositionRequest;
import com.taskboard.task.dto.TaskResponse;
import com.taskboard.task.dto.TaskSearchCondition;
import com.taskboard.task.dto.TaskUpdateRequest;
import com.taskboard.task.event.TaskAssignedEvent;
import com.taskboard.task.mapper.TaskMapper;
import com.taskboard.task.repository.TaskRepository;
import com.taskboard.task.repository.TaskSpecifications;
import com.taskboard.user.domain.User;
import com.taskboard.user.repository.UserRepository;
import com.taskboard.workspace.repository.WorkspaceMemberRepository;
import com.taskboard.workspace.repository.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Sort;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TaskService {

    private static final Sort BOARD_ORDER = Sort.by(Sort.Order.asc("category.position"), Sort.Order.asc("position"));

    private final TaskRepository taskRepository;
    private final CategoryRepository categoryRepository;
    private final WorkspaceRepository workspaceRepository;
    private final WorkspaceMemberRepository workspaceMemberRepository;
    private final UserRepository userRepository;
    private final PermissionService permissionService;
    private final OrderedCollectionManager orderedCollectionManager;
    private final TaskPositionScope taskPositionScope;
    private final TaskMapper taskMapper;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Tasks of a workspace in board order: by category position, then task position.
     */
    public List<TaskResponse> getTasks(Long userId, Long workspaceId, TaskSearchCondition condition) {
        permissionService.requireMember(userId, workspaceId);

        List<Task> tasks = taskRepository.findAll(TaskSpecifications.matching(workspaceId, condition), BOARD_ORDER);
        return toResponses(tasks);
    }

    public TaskResponse getTask(Long userId, Long workspaceId, Long taskId) {
        permissionService.requireMember(userId, workspaceId);

        return toResponse(findInWorkspace(taskId, workspaceId));
    }

    public List<TaskResponse> getSubtasks(Long userId, Long workspaceId, Long taskId) {
        permissionService.requireMember(userId, workspaceId);

        Task parent = findInWorkspace(taskId, workspaceId);
        return toResponses(taskRepository.findByParentTaskIdOrderByPositionAsc(parent.getId()));
    }

    /**
     * Creates a task (or a subtask when parentTaskId is given) at the end of its list.
     */
    @Transactional
    public TaskResponse createTask(User user, Long workspaceId, TaskCreateRequest request) {
        permissionService.requireEditor(user.getId(), workspaceId);

        Task parent = null;
        Category category = null;
        if (request.getParentTaskId() != null) {
            parent = findInWorkspace(request.getParentTaskId(), workspaceId);
            if (parent.isSubtask()) {
                throw new InvalidRequestException("Subtasks cannot have their own subtasks");
            }
        } else if (request.getCategoryId() != null) {
            category = findCategoryInWorkspace(request.getCategoryId(), workspaceId);
        }

        Set<User> assignees = resolveAssignees(workspaceId, request.getAssigneeIds());

        TaskScope scope = TaskScope.of(category == null ? null : category.getId(),
                parent == null ? null : parent.getId());
        int position = orderedCollectionManager.appendPosition(taskPositionScope, scope);

        Task task = Task.builder()
                .workspace(workspaceRepository.getReferenceById(workspaceId))
                .category(category)
                .parentTask(parent)
                .title(request.getTitle().trim())
                .description(request.getDescription())
                .priority(request.getPriority())
                .status(request.getStatus())
                .dueDate(request.getDueDate())
                .position(position)
                .createdBy(user)
                .assignees(assignees)
                .build();
        Task saved = taskRepository.save(task);

        publishAssignment(saved, ids(assignees), user.getId());
        log.info("Task created: id={}, workspace={}, scope={}, position={}", saved.getId(), workspaceId, scope, position);
        return taskMapper.toResponse(saved, 0L, 0L);
    }

    /**
     * Applies the fields present in the request. A category change appends the task to the new category.
     */
    @Transactional
    public TaskResponse updateTask(User user, Long workspaceId, Long taskId, TaskUpdateRequest request) {
        permissionService.requireEditor(user.getId(), workspaceId);

        Task task = findInWorkspace(taskId, workspaceId);

        if (request.hasTitle()) {
            String title = request.title().map(String::trim).orElse("");
            if (title.isEmpty()) {
                throw new InvalidRequestException("Task title cannot be empty");
            }
            task.changeTitle(title);
        }
        if (request.hasDescription()) {
            task.changeDescription(request.description().orElse(null));
        }
        if (request.hasPriority()) {
            task.changePriority(request.priority()
                    .orElseThrow(() -> new InvalidRequestException("Priority cannot be null")));
        }
        if (request.hasStatus()) {
            task.changeStatus(request.status()
                    .orElseThrow(() -> new InvalidRequestException("Status cannot be null")));
        }
        if (request.hasDueDate()) {
            task.changeDueDate(request.dueDate().orElse(null));
        }
        if (request.hasAssigneeIds()) {
            Set<Long> added = task.replaceAssignees(resolveAssignees(workspaceId, request.assigneeIds()));
            publishAssignment(task, added, user.getId());
        }

        if (request.hasCategoryId()) {
            Long currentCategoryId = task.getCategory() == null ? null : task.getCategory().getId();
            Long targetCategoryId = request.categoryId().orElse(null);
            if (!Objects.equals(currentCategoryId, targetCategoryId)) {
                if (task.isSubtask()) {
                    throw new InvalidRequestException("Subtasks cannot be assigned to a category");
                }
                if (targetCategoryId != null) {
                    findCategoryInWorkspace(targetCategoryId, workspaceId);
                }
                // append at the end of the target category
                orderedCollectionManager.move(taskPositionScope, taskId,
                        TaskScope.of(task), task.getPosition(),
                        TaskScope.of(targetCategoryId, null), Integer.MAX_VALUE);
            }
        }

        taskRepository.flush();
        return toResponse(reload(taskId, task));
    }

    /**
     * Moves a task to {@code position} in the requested category, or within its current list.
     * Subtasks only move among the subtasks of their parent.
     */
    @Transactional
    public TaskResponse moveTask(Long userId, Long workspaceId, Long taskId, TaskPositionRequest request) {
        permissionService.requireEditor(userId, workspaceId);

        Task task = findInWorkspace(taskId, workspaceId);
        TaskScope source = TaskScope.of(task);

        TaskScope target;
        if (task.isSubtask()) {
            if (request.getCategoryId() != null) {
                throw new InvalidRequestException("Subtasks can only be reordered within their parent task");
            }
            target = source;
        } else if (request.getCategoryId() != null) {
            findCategoryInWorkspace(request.getCategoryId(), workspaceId);
            target = TaskScope.ofCategory(request.getCategoryId());
        } else if (source != null) {
            target = source;
        } else {
            throw new InvalidRequestException("Task has no category; provide categoryId to position it");
        }

        int position = orderedCollectionManager.move(taskPositionScope, taskId,
                source, task.getPosition(), target, request.getPosition());

        log.info("Task moved: id={}, from={}@{}, to={}@{}", taskId, source, task.getPosition(), target, position);
        return toResponse(reload(taskId, task));
    }

    /**
     * Deletes a task together with its subtasks and closes the gap in its list.
     */
    @Transactional
    public void deleteTask(Long userId, Long workspaceId, Long taskId) {
        permissionService.requireEditor(userId, workspaceId);

        Task task = findInWorkspace(taskId, workspaceId);
        List<Task> subtasks = task.isSubtask()
                ? List.of()
                : taskRepository.findByParentTaskIdOrderByPositionAsc(taskId);

        orderedCollectionManager.remove(taskPositionScope, TaskScope.of(task), task.getPosition(), () -> {
            taskRepository.deleteAll(subtasks);
            taskRepository.delete(task);
        });

        log.info("Task deleted: id={}, workspace={}, subtasks={}", taskId, workspaceId, subtasks.size());
    }

    /**
     * Rewrites the order of one list. All tasks must come from the same category, or the same parent.
     */
    @Transactional
    public List<TaskResponse> reorderTasks(Long userId, List<Long> taskIds) {
        List<Task> tasks = taskRepository.findAllById(taskIds);
        Set<Long> found = tasks.stream().map(Task::getId).collect(Collectors.toSet());
        for (Long id : new HashSet<>(taskIds)) {
            if (!found.contains(id)) {
                throw new TaskNotFoundException("Task not found with id: " + id);
            }
        }

        Set<Long> workspaceIds = tasks.stream().map(t -> t.getWorkspace().getId()).collect(Collectors.toSet());
        if (workspaceIds.size() != 1) {
            throw new MixedScopeReorderException("All tasks must belong to the same workspace");
        }
        Long workspaceId = workspaceIds.iterator().next();
        permissionService.requireEditor(userId, workspaceId);

        Set<TaskScope> scopes = tasks.stream().map(TaskScope::of).collect(Collectors.toCollection(HashSet::new));
        if (scopes.size() != 1 || scopes.contains(null)) {
            throw new MixedScopeReorderException("All tasks must belong to the same category");
        }
        TaskScope scope = scopes.iterator().next();

        orderedCollectionManager.reorder(taskPositionScope, scope, taskIds);

        Map<Long, Task> reloaded = taskRepository.findAllById(taskIds).stream()
                .collect(Collectors.toMap(Task::getId, Function.identity()));
        List<Task> ordered = new ArrayList<>();
        for (Long id : taskIds) {
            ordered.add(reloaded.get(id));
        }
        return toResponses(ordered);
    }

    /**
     * Cross-tenant lookup: a task from another workspace is reported as no access, not as missing.
     */
    Task findInWorkspace(Long taskId, Long workspaceId) {
        return taskRepository.findByIdAndWorkspaceId(taskId, workspaceId)
                .orElseThrow(() -> {
                    if (taskRepository.existsById(taskId)) {
                        log.warn("Access denied: task={} is outside workspace={}", taskId, workspaceId);
                        return new AccessDeniedException(PermissionService.NO_ACCESS_MESSAGE);
                    }
                    return new TaskNotFoundException("Task not found with id: " + taskId);
                });
    }

    private Category findCategoryInWorkspace(Long categoryId, Long workspaceId) {
        return categoryRepository.findByIdAndWorkspaceId(categoryId, workspaceId)
                .orElseThrow(() -> {
                    if (categoryRepository.existsById(categoryId)) {
                        log.warn("Access denied: category={} is outside workspace={}", categoryId, workspaceId);
                        return new AccessDeniedException(PermissionService.NO_ACCESS_MESSAGE);
                    }
                    return new CategoryNotFoundException("Category not found with id: " + categoryId);
                });
    }

    private Set<User> resolveAssignees(Long workspaceId, Collection<Long> assigneeIds) {
        if (assigneeIds == null || assigneeIds.isEmpty()) {
            return new LinkedHashSet<>();
        }
        Set<Long> distinct = new LinkedHashSet<>(assigneeIds);
        if (workspaceMemberRepository.countMembersAmong(workspaceId, distinct) != distinct.size()) {
            throw new InvalidRequestException("All assignees must be members of this workspace");
        }
        return new LinkedHashSet<>(userRepository.findAllById(distinct));
    }

    private void publishAssignment(Task task, Set<Long> assigneeIds, Long actorId) {
        if (assigneeIds.isEmpty()) {
            return;
        }
        eventPublisher.publishEvent(new TaskAssignedEvent(task.getId(), task.getWorkspace().getId(),
                task.getTitle(), Set.copyOf(assigneeIds), actorId));
    }

    private Task reload(Long taskId, Task current) {
        return taskRepository.findById(taskId).orElse(current);
    }

    private static Set<Long> ids(Set<User> users) {
        return users.stream().map(User::getId).collect(Collectors.toSet());
    }

    private TaskResponse toResponse(Task task) {
        return toResponses(List.of(task)).get(0);
    }

    private List<TaskResponse> toResponses(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        List<Long> ids = tasks.stream().map(Task::getId).collect(Collectors.toList());
        Map<Long, TaskRepository.SubtaskCount> counts = taskRepository.countSubtasks(ids, TaskStatus.COMPLETED)
                .stream()
                .collect(Collectors.toMap(TaskRepository.SubtaskCount::getParentTaskId, Function.identity()));
        return tasks.stream()
                .map(task -> {
                    TaskRepository.SubtaskCount count = counts.get(task.getId());
                    return count == null
                            ? taskMapper.toResponse(task, 0L, 0L)
                            : taskMapper.toResponse(task, count.getSubtaskCount(), count.getCompletedSubtaskCount());
                })
                .collect(Collectors.toList());
    }
}
