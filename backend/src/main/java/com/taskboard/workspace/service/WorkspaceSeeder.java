package com.taskboard.workspace.service;

import com.taskboard.category.domain.Category;
import com.taskboard.category.repository.CategoryRepository;
import com.taskboard.task.domain.Task;
import com.taskboard.task.domain.TaskPriority;
import com.taskboard.task.repository.TaskRepository;
import com.taskboard.user.domain.User;
import com.taskboard.workspace.domain.Workspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills a freshly created workspace with the default board.
 * Runs inside the creating transaction; a failure here rolls the workspace back too.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkspaceSeeder {

    static final List<String> DEFAULT_CATEGORIES = List.of("To Do", "In Progress", "Completed");

    private static final List<String> CATEGORY_COLORS = List.of("#3B82F6", "#F59E0B", "#10B981");

    private static final List<StarterTask> STARTER_TASKS = List.of(
            new StarterTask("Invite your team members", TaskPriority.HIGH,
                    List.of("Open workspace settings", "Send an invitation by email")),
            new StarterTask("Customize your categories", TaskPriority.MEDIUM,
                    List.of("Rename a category", "Pick a color for each category")),
            new StarterTask("Explore the board", TaskPriority.LOW,
                    List.of("Drag a task to another category", "Complete a subtask")));

    private final CategoryRepository categoryRepository;
    private final TaskRepository taskRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public void seed(Workspace workspace, User owner) {
        List<Category> categories = new ArrayList<>();
        for (int i = 0; i < DEFAULT_CATEGORIES.size(); i++) {
            categories.add(categoryRepository.save(Category.builder()
                    .workspace(workspace)
                    .name(DEFAULT_CATEGORIES.get(i))
                    .color(CATEGORY_COLORS.get(i))
                    .position(i)
                    .createdBy(owner)
                    .build()));
        }

        // starter tasks go into the first category
        Category todo = categories.get(0);
        for (int i = 0; i < STARTER_TASKS.size(); i++) {
            StarterTask starter = STARTER_TASKS.get(i);
            Task task = taskRepository.save(Task.builder()
                    .workspace(workspace)
                    .category(todo)
                    .title(starter.title())
                    .priority(starter.priority())
                    .position(i)
                    .createdBy(owner)
                    .build());

            for (int j = 0; j < starter.subtasks().size(); j++) {
                taskRepository.save(Task.builder()
                        .workspace(workspace)
                        .parentTask(task)
                        .title(starter.subtasks().get(j))
                        .position(j)
                        .createdBy(owner)
                        .build());
            }
        }

        log.info("Seeded workspace={} with {} categories and {} starter tasks",
                workspace.getId(), categories.size(), STARTER_TASKS.size());
    }

    private record StarterTask(String title, TaskPriority priority, List<String> subtasks) {
    }
}
