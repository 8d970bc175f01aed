package com.taskboard.category.service;

import com.taskboard.category.repository.CategoryRepository;
import com.taskboard.common.position.PositionScope;
import com.taskboard.exception.WorkspaceNotFoundException;
import com.taskboard.workspace.repository.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Categories are ordered per workspace; the workspace row is the lock.
 */
@Component
@RequiredArgsConstructor
public class CategoryPositionScope implements PositionScope<Long> {

    private static final long NO_ID = -1L;

    private final CategoryRepository categoryRepository;
    private final WorkspaceRepository workspaceRepository;

    @Override
    public void lock(Long workspaceId) {
        workspaceRepository.findByIdForUpdate(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Workspace not found with id: " + workspaceId));
    }

    @Override
    public int maxPosition(Long workspaceId) {
        return categoryRepository.findMaxPosition(workspaceId);
    }

    @Override
    public long countExcluding(Long workspaceId, Long excludedId) {
        return categoryRepository.countExcluding(workspaceId, orNone(excludedId));
    }

    @Override
    public void shiftUp(Long workspaceId, int fromInclusive, Long excludedId) {
        categoryRepository.shiftUp(workspaceId, fromInclusive, orNone(excludedId));
    }

    @Override
    public void shiftDown(Long workspaceId, int afterExclusive, Long excludedId) {
        categoryRepository.shiftDown(workspaceId, afterExclusive, orNone(excludedId));
    }

    @Override
    public void place(Long id, Long workspaceId, int position) {
        // categories never change workspace
        categoryRepository.updatePosition(id, position);
    }

    @Override
    public List<Long> idsInScope(Long workspaceId) {
        return categoryRepository.findIdsByWorkspaceId(workspaceId);
    }

    @Override
    public String scopeName(Long workspaceId) {
        return "workspace";
    }

    private static Long orNone(Long id) {
        return id == null ? NO_ID : id;
    }
}
