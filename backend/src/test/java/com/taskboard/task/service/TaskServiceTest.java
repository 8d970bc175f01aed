package com.taskboard.task.service;

import com.taskboard.category.domain.Category;
import com.taskboard.category.repository.CategoryRepository;
import com.taskboard.common.position.OrderedCollectionManager;
import com.taskboard.common.service.PermissionService;
import com.taskboard.exception.InsufficientRoleException;
import com.taskboard.exception.InvalidRequestException;
import com.taskboard.exception.MixedScopeReorderException;
import com.taskboard.task.domain.Task;
import com.taskboard.task.domain.TaskScope;
import com.taskboard.task.dto.TaskCreateRequest;
import com.taskboard.task.dto.TaskPositionRequest;
import com.taskboard.task.dto.TaskUpdateRequest;
import com.taskboard.task.event.TaskAssignedEvent;
import com.taskboard.task.mapper.TaskMapper;
import com.taskboard.task.repository.TaskRepository;
import com.taskboard.user.domain.User;
import com.taskboard.user.repository.UserRepository;
import com.taskboard.workspace.domain.Workspace;
import com.taskboard.workspace.domain.WorkspaceRole;
import com.taskboard.workspace.repository.WorkspaceMemberRepository;
import com.taskboard.workspace.repository.WorkspaceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.access.AccessDeniedException;

import java.lang.reflect.Field;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskService 단위 테스트")
class TaskServiceTest {

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private WorkspaceRepository workspaceRepository;

    @Mock
    private WorkspaceMemberRepository workspaceMemberRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private PermissionService permissionService;

    @Mock
    private OrderedCollectionManager orderedCollectionManager;

    @Mock
    private TaskPositionScope taskPositionScope;

    @Mock
    private TaskMapper taskMapper;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private TaskService taskService;

    private User author;
    private User assignee;
    private Workspace workspace;
    private Category todo;
    private Category doing;
    private Task task;

    private static final Long WORKSPACE_ID = 1L;
    private static final Long VIEWER_ID = 3L;

    @BeforeEach
    void setUp() throws Exception {
        author = createUser(1L, "author");
        assignee = createUser(2L, "assignee");

        workspace = Workspace.builder()
                .name("Team")
                .owner(author)
                .build();
        setField(workspace, "id", WORKSPACE_ID);

        todo = createCategory(10L, "To Do", 0);
        doing = createCategory(11L, "In Progress", 1);
        task = createTask(100L, todo, null, 0);
    }

    private User createUser(Long id, String name) throws Exception {
        User user = User.builder()
                .authUserId("auth-" + id)
                .email(name + "@example.com")
                .name(name)
                .build();
        setField(user, "id", id);
        return user;
    }

    private Category createCategory(Long id, String name, int position) throws Exception {
        Category category = Category.builder()
                .workspace(workspace)
                .name(name)
                .position(position)
                .build();
        setField(category, "id", id);
        return category;
    }

    private Task createTask(Long id, Category category, Task parent, int position) throws Exception {
        Task created = Task.builder()
                .workspace(workspace)
                .category(category)
                .parentTask(parent)
                .title("Task " + id)
                .position(position)
                .createdBy(author)
                .build();
        setField(created, "id", id);
        return created;
    }

    private void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    @Test
    @DisplayName("태스크를 카테고리 끝에 추가하고 담당자 알림 이벤트를 발행한다")
    void createTask_AppendsAndPublishesAssignment() {
        // given
        TaskCreateRequest request = TaskCreateRequest.builder()
                .title(" Write docs ")
                .categoryId(10L)
                .assigneeIds(List.of(2L))
                .build();
        when(categoryRepository.findByIdAndWorkspaceId(10L, WORKSPACE_ID)).thenReturn(Optional.of(todo));
        when(workspaceMemberRepository.countMembersAmong(WORKSPACE_ID, Set.of(2L))).thenReturn(1L);
        when(userRepository.findAllById(Set.of(2L))).thenReturn(List.of(assignee));
        when(orderedCollectionManager.appendPosition(taskPositionScope, TaskScope.ofCategory(10L))).thenReturn(2);
        when(workspaceRepository.getReferenceById(WORKSPACE_ID)).thenReturn(workspace);
        when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // when
        taskService.createTask(author, WORKSPACE_ID, request);

        // then
        ArgumentCaptor<Task> saved = ArgumentCaptor.forClass(Task.class);
        verify(taskRepository).save(saved.capture());
        assertThat(saved.getValue().getTitle()).isEqualTo("Write docs");
        assertThat(saved.getValue().getPosition()).isEqualTo(2);
        assertThat(saved.getValue().getCategory()).isSameAs(todo);

        ArgumentCaptor<TaskAssignedEvent> event = ArgumentCaptor.forClass(TaskAssignedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().assigneeIds()).containsExactly(2L);
        assertThat(event.getValue().assignedBy()).isEqualTo(1L);
    }

    @Test
    @DisplayName("워크스페이스 멤버가 아닌 담당자가 있으면 InvalidRequestException이 발생한다")
    void createTask_AssigneeNotMember() {
        // given
        TaskCreateRequest request = TaskCreateRequest.builder()
                .title("Write docs")
                .assigneeIds(List.of(2L, 99L))
                .build();
        when(workspaceMemberRepository.countMembersAmong(eq(WORKSPACE_ID), any())).thenReturn(1L);

        // when & then
        assertThatThrownBy(() -> taskService.createTask(author, WORKSPACE_ID, request))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("All assignees must be members of this workspace");
        verify(taskRepository, never()).save(any());
    }

    @Test
    @DisplayName("서브태스크 아래에는 서브태스크를 만들 수 없다")
    void createTask_NestedSubtask() throws Exception {
        // given
        Task subtask = createTask(101L, null, task, 0);
        TaskCreateRequest request = TaskCreateRequest.builder()
                .title("Too deep")
                .parentTaskId(101L)
                .build();
        when(taskRepository.findByIdAndWorkspaceId(101L, WORKSPACE_ID)).thenReturn(Optional.of(subtask));

        // when & then
        assertThatThrownBy(() -> taskService.createTask(author, WORKSPACE_ID, request))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("Subtasks cannot have their own subtasks");
    }

    @Test
    @DisplayName("다른 카테고리로 이동하면 원본과 대상 스코프를 함께 넘긴다")
    void moveTask_AcrossCategories() {
        // given
        TaskPositionRequest request = TaskPositionRequest.builder()
                .categoryId(11L)
                .position(1)
                .build();
        when(taskRepository.findByIdAndWorkspaceId(100L, WORKSPACE_ID)).thenReturn(Optional.of(task));
        when(categoryRepository.findByIdAndWorkspaceId(11L, WORKSPACE_ID)).thenReturn(Optional.of(doing));

        // when
        taskService.moveTask(1L, WORKSPACE_ID, 100L, request);

        // then
        verify(orderedCollectionManager).move(taskPositionScope, 100L,
                TaskScope.ofCategory(10L), 0, TaskScope.ofCategory(11L), 1);
    }

    @Test
    @DisplayName("서브태스크는 카테고리를 지정해 이동할 수 없다")
    void moveTask_SubtaskWithCategory() throws Exception {
        // given
        Task subtask = createTask(101L, null, task, 0);
        TaskPositionRequest request = TaskPositionRequest.builder()
                .categoryId(11L)
                .position(0)
                .build();
        when(taskRepository.findByIdAndWorkspaceId(101L, WORKSPACE_ID)).thenReturn(Optional.of(subtask));

        // when & then
        assertThatThrownBy(() -> taskService.moveTask(1L, WORKSPACE_ID, 101L, request))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(orderedCollectionManager);
    }

    @Test
    @DisplayName("카테고리를 바꾸면 새 카테고리의 끝으로 이동한다")
    void updateTask_CategoryChangeAppends() {
        // given
        TaskUpdateRequest request = new TaskUpdateRequest();
        request.setCategoryId(11L);
        when(taskRepository.findByIdAndWorkspaceId(100L, WORKSPACE_ID)).thenReturn(Optional.of(task));
        when(categoryRepository.findByIdAndWorkspaceId(11L, WORKSPACE_ID)).thenReturn(Optional.of(doing));

        // when
        taskService.updateTask(author, WORKSPACE_ID, 100L, request);

        // then
        verify(orderedCollectionManager).move(taskPositionScope, 100L,
                TaskScope.ofCategory(10L), 0, TaskScope.ofCategory(11L), Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("태스크를 삭제하면 서브태스크도 함께 삭제된다")
    void deleteTask_CascadesSubtasks() throws Exception {
        // given
        Task subtask = createTask(101L, null, task, 0);
        when(taskRepository.findByIdAndWorkspaceId(100L, WORKSPACE_ID)).thenReturn(Optional.of(task));
        when(taskRepository.findByParentTaskIdOrderByPositionAsc(100L)).thenReturn(List.of(subtask));

        // when
        taskService.deleteTask(1L, WORKSPACE_ID, 100L);

        // then
        ArgumentCaptor<Runnable> deletion = ArgumentCaptor.forClass(Runnable.class);
        verify(orderedCollectionManager).remove(eq(taskPositionScope), eq(TaskScope.ofCategory(10L)), eq(0),
                deletion.capture());
        deletion.getValue().run();
        verify(taskRepository).deleteAll(List.of(subtask));
        verify(taskRepository).delete(task);
    }

    @Test
    @DisplayName("서로 다른 카테고리의 태스크는 함께 재정렬할 수 없다")
    void reorderTasks_MixedCategories() throws Exception {
        // given
        Task other = createTask(200L, doing, null, 0);
        when(taskRepository.findAllById(List.of(100L, 200L))).thenReturn(List.of(task, other));

        // when & then
        assertThatThrownBy(() -> taskService.reorderTasks(1L, List.of(100L, 200L)))
                .isInstanceOf(MixedScopeReorderException.class)
                .hasMessage("All tasks must belong to the same category");
        verifyNoInteractions(orderedCollectionManager);
    }

    @Test
    @DisplayName("다른 워크스페이스의 태스크는 접근 거부로 처리한다")
    void getTask_CrossTenant() {
        // given
        when(taskRepository.findByIdAndWorkspaceId(500L, WORKSPACE_ID)).thenReturn(Optional.empty());
        when(taskRepository.existsById(500L)).thenReturn(true);

        // when & then
        assertThatThrownBy(() -> taskService.getTask(1L, WORKSPACE_ID, 500L))
                .isInstanceOf(AccessDeniedException.class)
                .hasMessage(PermissionService.NO_ACCESS_MESSAGE);
        verifyNoInteractions(orderedCollectionManager);
    }

    @Test
    @DisplayName("viewer는 태스크를 만들 수 없다")
    void createTask_ViewerDenied() throws Exception {
        // given
        User viewer = createUser(VIEWER_ID, "viewer");
        TaskCreateRequest request = TaskCreateRequest.builder()
                .title("Write docs")
                .categoryId(10L)
                .build();
        denyViewer();

        // when & then
        assertThatThrownBy(() -> taskService.createTask(viewer, WORKSPACE_ID, request))
                .isInstanceOf(InsufficientRoleException.class);
        verifyNoInteractions(taskRepository, categoryRepository, orderedCollectionManager, eventPublisher);
    }

    @Test
    @DisplayName("viewer는 태스크를 수정할 수 없다")
    void updateTask_ViewerDenied() throws Exception {
        // given
        User viewer = createUser(VIEWER_ID, "viewer");
        TaskUpdateRequest request = new TaskUpdateRequest();
        request.setTitle("Renamed");
        denyViewer();

        // when & then
        assertThatThrownBy(() -> taskService.updateTask(viewer, WORKSPACE_ID, 100L, request))
                .isInstanceOf(InsufficientRoleException.class);
        verifyNoInteractions(taskRepository, orderedCollectionManager, eventPublisher);
        assertThat(task.getTitle()).isEqualTo("Task 100");
    }

    @Test
    @DisplayName("viewer는 태스크를 이동할 수 없다")
    void moveTask_ViewerDenied() {
        // given
        TaskPositionRequest request = TaskPositionRequest.builder()
                .categoryId(11L)
                .position(0)
                .build();
        denyViewer();

        // when & then
        assertThatThrownBy(() -> taskService.moveTask(VIEWER_ID, WORKSPACE_ID, 100L, request))
                .isInstanceOf(InsufficientRoleException.class);
        verifyNoInteractions(taskRepository, categoryRepository, orderedCollectionManager);
    }

    @Test
    @DisplayName("viewer는 태스크를 삭제할 수 없다")
    void deleteTask_ViewerDenied() {
        // given
        denyViewer();

        // when & then
        assertThatThrownBy(() -> taskService.deleteTask(VIEWER_ID, WORKSPACE_ID, 100L))
                .isInstanceOf(InsufficientRoleException.class);
        verifyNoInteractions(taskRepository, orderedCollectionManager);
    }

    @Test
    @DisplayName("viewer는 태스크를 재정렬할 수 없다")
    void reorderTasks_ViewerDenied() throws Exception {
        // given
        Task second = createTask(101L, todo, null, 1);
        when(taskRepository.findAllById(List.of(101L, 100L))).thenReturn(List.of(task, second));
        denyViewer();

        // when & then
        assertThatThrownBy(() -> taskService.reorderTasks(VIEWER_ID, List.of(101L, 100L)))
                .isInstanceOf(InsufficientRoleException.class);
        verify(taskRepository).findAllById(List.of(101L, 100L));
        verifyNoMoreInteractions(taskRepository);
        verifyNoInteractions(orderedCollectionManager);
    }

    private void denyViewer() {
        when(permissionService.requireEditor(VIEWER_ID, WORKSPACE_ID))
                .thenThrow(new InsufficientRoleException(List.of(WorkspaceRole.ADMIN, WorkspaceRole.MEMBER),
                        WorkspaceRole.VIEWER));
    }
}
