package com.taskboard.category.service;

import com.taskboard.category.domain.Category;
import com.taskboard.category.dto.CategoryCreateRequest;
import com.taskboard.category.dto.CategoryResponse;
import com.taskboard.category.dto.CategoryUpdateRequest;
import com.taskboard.category.mapper.CategoryMapper;
import com.taskboard.category.repository.CategoryRepository;
import com.taskboard.common.position.OrderedCollectionManager;
import com.taskboard.common.service.PermissionService;
import com.taskboard.exception.CategoryNotEmptyException;
import com.taskboard.exception.CategoryNotFoundException;
import com.taskboard.exception.DuplicateCategoryNameException;
import com.taskboard.exception.InvalidRequestException;
import com.taskboard.exception.MixedScopeReorderException;
import com.taskboard.task.repository.TaskRepository;
import com.taskboard.user.domain.User;
import com.taskboard.workspace.domain.Workspace;
import com.taskboard.workspace.repository.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final TaskRepository taskRepository;
    private final WorkspaceRepository workspaceRepository;
    private final PermissionService permissionService;
    private final OrderedCollectionManager orderedCollectionManager;
    private final CategoryPositionScope categoryPositionScope;
    private final CategoryMapper categoryMapper;

    public List<CategoryResponse> getCategories(Long userId, Long workspaceId) {
        permissionService.requireMember(userId, workspaceId);

        List<Category> categories = categoryRepository.findByWorkspaceIdOrderByPositionAsc(workspaceId);
        return toResponses(categories);
    }

    public CategoryResponse getCategory(Long userId, Long workspaceId, Long categoryId) {
        permissionService.requireMember(userId, workspaceId);

        Category category = findInWorkspace(categoryId, workspaceId);
        return categoryMapper.toResponse(category, taskRepository.countByCategoryId(categoryId));
    }

    /**
     * Appends a new category at the end of the workspace's board.
     */
    @Transactional
    public CategoryResponse createCategory(User user, Long workspaceId, CategoryCreateRequest request) {
        permissionService.requireEditor(user.getId(), workspaceId);

        // lock first so the duplicate check and the position read see the same state
        int position = orderedCollectionManager.appendPosition(categoryPositionScope, workspaceId);

        String name = request.getName().trim();
        if (categoryRepository.existsByWorkspaceIdAndNameIgnoreCase(workspaceId, name)) {
            throw new DuplicateCategoryNameException("A category with this name already exists");
        }

        Workspace workspace = workspaceRepository.getReferenceById(workspaceId);
        Category category = Category.builder()
                .workspace(workspace)
                .name(name)
                .color(request.getColor())
                .position(position)
                .createdBy(user)
                .build();
        Category saved = categoryRepository.save(category);

        log.info("Category created: id={}, workspace={}, position={}", saved.getId(), workspaceId, position);
        return categoryMapper.toResponse(saved, 0L);
    }

    @Transactional
    public CategoryResponse updateCategory(Long userId, Long workspaceId, Long categoryId,
                                           CategoryUpdateRequest request) {
        permissionService.requireEditor(userId, workspaceId);

        Category category = findInWorkspace(categoryId, workspaceId);

        if (request.getName() != null) {
            String name = request.getName().trim();
            if (name.isEmpty()) {
                throw new InvalidRequestException("Category name cannot be empty");
            }
            if (categoryRepository.existsByWorkspaceIdAndNameIgnoreCaseAndIdNot(workspaceId, name, categoryId)) {
                throw new DuplicateCategoryNameException("A category with this name already exists");
            }
            category.rename(name);
        }
        if (request.getColor() != null) {
            category.changeColor(request.getColor());
        }
        if (request.getPosition() != null) {
            orderedCollectionManager.move(categoryPositionScope, categoryId,
                    workspaceId, category.getPosition(), workspaceId, request.getPosition());
        }

        categoryRepository.flush();
        Category updated = reload(categoryId, category);
        return categoryMapper.toResponse(updated, taskRepository.countByCategoryId(categoryId));
    }

    /**
     * Deletes an empty category and closes the gap it leaves.
     */
    @Transactional
    public void deleteCategory(Long userId, Long workspaceId, Long categoryId) {
        permissionService.requireEditor(userId, workspaceId);

        // workspace row before category row: moves take the first, task writers the second
        categoryPositionScope.lock(workspaceId);
        findInWorkspace(categoryId, workspaceId);
        Category category = categoryRepository.findByIdForUpdate(categoryId)
                .orElseThrow(() -> new CategoryNotFoundException("Category not found with id: " + categoryId));

        long taskCount = taskRepository.countByCategoryId(categoryId);
        if (taskCount > 0) {
            throw new CategoryNotEmptyException(taskCount);
        }

        orderedCollectionManager.remove(categoryPositionScope, workspaceId, category.getPosition(),
                () -> categoryRepository.delete(category));

        log.info("Category deleted: id={}, workspace={}", categoryId, workspaceId);
    }

    /**
     * Rewrites the order of every category in one workspace. The workspace is taken from the categories.
     */
    @Transactional
    public List<CategoryResponse> reorderCategories(Long userId, List<Long> categoryIds) {
        List<Category> categories = categoryRepository.findAllById(categoryIds);
        Set<Long> found = categories.stream().map(Category::getId).collect(Collectors.toSet());
        for (Long id : new HashSet<>(categoryIds)) {
            if (!found.contains(id)) {
                throw new CategoryNotFoundException("Category not found with id: " + id);
            }
        }

        Set<Long> workspaceIds = categories.stream()
                .map(category -> category.getWorkspace().getId())
                .collect(Collectors.toSet());
        if (workspaceIds.size() != 1) {
            throw new MixedScopeReorderException("All categories must belong to the same workspace");
        }
        Long workspaceId = workspaceIds.iterator().next();

        permissionService.requireEditor(userId, workspaceId);

        orderedCollectionManager.reorder(categoryPositionScope, workspaceId, categoryIds);

        return toResponses(categoryRepository.findByWorkspaceIdOrderByPositionAsc(workspaceId));
    }

    /**
     * Cross-tenant lookup: a category from another workspace is reported as no access, not as missing.
     */
    Category findInWorkspace(Long categoryId, Long workspaceId) {
        return categoryRepository.findByIdAndWorkspaceId(categoryId, workspaceId)
                .orElseThrow(() -> {
                    if (categoryRepository.existsById(categoryId)) {
                        log.warn("Access denied: category={} is outside workspace={}", categoryId, workspaceId);
                        return new AccessDeniedException(PermissionService.NO_ACCESS_MESSAGE);
                    }
                    return new CategoryNotFoundException("Category not found with id: " + categoryId);
                });
    }

    private Category reload(Long categoryId, Category current) {
        return categoryRepository.findById(categoryId).orElse(current);
    }

    private List<CategoryResponse> toResponses(List<Category> categories) {
        if (categories.isEmpty()) {
            return List.of();
        }
        List<Long> ids = categories.stream().map(Category::getId).collect(Collectors.toList());
        Map<Long, Long> counts = taskRepository.countByCategoryIds(ids).stream()
                .collect(Collectors.toMap(TaskRepository.CategoryTaskCount::getCategoryId,
                        TaskRepository.CategoryTaskCount::getTaskCount));
        return categories.stream()
                .map(category -> categoryMapper.toResponse(category, counts.getOrDefault(category.getId(), 0L)))
                .collect(Collectors.toList());
    }
}
