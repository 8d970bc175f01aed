package com.taskboard.common.service;

import com.taskboard.exception.InsufficientRoleException;
import com.taskboard.exception.MissingWorkspaceIdException;
import com.taskboard.workspace.domain.Workspace;
import com.taskboard.workspace.domain.WorkspaceMember;
import com.taskboard.workspace.domain.WorkspaceRole;
import com.taskboard.workspace.repository.WorkspaceMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a caller's membership in a workspace and checks it against the required role.
 * Used internally by the service layer before any business data is read or written.
 *
 * Design: Explicit, type-safe, loggable authorization checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PermissionService {

    public static final String NO_ACCESS_MESSAGE = "You do not have access to this workspace";

    private final WorkspaceMemberRepository workspaceMemberRepository;

    public Optional<WorkspaceMember> resolve(Long userId, Long workspaceId) {
        if (userId == null || workspaceId == null) {
            return Optional.empty();
        }
        return workspaceMemberRepository.findByWorkspaceIdAndUserId(workspaceId, userId);
    }

    /**
     * Admins and members can write. Viewers and non-members cannot.
     */
    public boolean canMutate(WorkspaceMember membership) {
        return membership != null && membership.getRole().canMutate();
    }

    public boolean isAdmin(WorkspaceMember membership) {
        return membership != null && membership.getRole().isAdmin();
    }

    /**
     * Check if user is a workspace member.
     * Throws MissingWorkspaceIdException without a workspace id, AccessDeniedException without membership.
     */
    public WorkspaceMember requireMember(Long userId, Long workspaceId) {
        if (workspaceId == null) {
            throw new MissingWorkspaceIdException();
        }
        return resolve(userId, workspaceId).orElseThrow(() -> {
            log.warn("Access denied: user={} is not a member of workspace={}", userId, workspaceId);
            return new AccessDeniedException(NO_ACCESS_MESSAGE);
        });
    }

    /**
     * Check that the user's role in the workspace is one of {@code allowed}.
     */
    public WorkspaceMember requireRole(Long userId, Long workspaceId, WorkspaceRole... allowed) {
        WorkspaceMember membership = requireMember(userId, workspaceId);
        List<WorkspaceRole> allowedRoles = Arrays.asList(allowed);
        if (!allowedRoles.contains(membership.getRole())) {
            log.warn("Access denied: user={} has role={} in workspace={}, required={}",
                    userId, membership.getRole(), workspaceId, allowedRoles);
            throw new InsufficientRoleException(allowedRoles, membership.getRole());
        }
        return membership;
    }

    public WorkspaceMember requireEditor(Long userId, Long workspaceId) {
        return requireRole(userId, workspaceId, WorkspaceRole.ADMIN, WorkspaceRole.MEMBER);
    }

    public WorkspaceMember requireAdmin(Long userId, Long workspaceId) {
        return requireRole(userId, workspaceId, WorkspaceRole.ADMIN);
    }

    public void requireOwner(Long userId, Workspace workspace) {
        if (!workspace.isOwnedBy(userId)) {
            log.warn("Access denied: user={} is not the owner of workspace={}", userId, workspace.getId());
            throw new AccessDeniedException("Only the workspace owner can delete the workspace");
        }
    }
}
