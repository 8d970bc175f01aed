package com.taskboard.workspace.service;

import com.taskboard.common.service.PermissionService;
import com.taskboard.exception.InsufficientRoleException;
import com.taskboard.exception.MemberNotFoundException;
import com.taskboard.exception.OwnerProtectionException;
import com.taskboard.onboarding.repository.OnboardingProgressRepository;
import com.taskboard.task.repository.TaskRepository;
import com.taskboard.workspace.domain.WorkspaceMember;
import com.taskboard.workspace.domain.WorkspaceRole;
import com.taskboard.workspace.dto.MemberResponse;
import com.taskboard.workspace.mapper.WorkspaceMemberMapper;
import com.taskboard.workspace.repository.WorkspaceMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Role changes and removal of workspace members.
 *
 * Check order: actor membership, target lookup, owner protection, then the actor's role.
 * Owner protection wins over the role check, so even an admin gets the owner message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WorkspaceMemberService {

    static final String LEFT_MESSAGE = "You have left the workspace";
    static final String REMOVED_MESSAGE = "Member removed successfully";

    private final WorkspaceMemberRepository workspaceMemberRepository;
    private final OnboardingProgressRepository onboardingProgressRepository;
    private final TaskRepository taskRepository;
    private final PermissionService permissionService;
    private final WorkspaceMemberMapper workspaceMemberMapper;

    @Transactional
    public MemberResponse updateMemberRole(Long actorId, Long workspaceId, Long memberId, WorkspaceRole role) {
        WorkspaceMember actor = permissionService.requireMember(actorId, workspaceId);
        WorkspaceMember target = findInWorkspace(memberId, workspaceId);

        if (target.getWorkspace().isOwnedBy(target.getUser().getId())) {
            throw new OwnerProtectionException("Cannot change workspace owner's role");
        }
        requireAdmin(actor);

        WorkspaceRole previous = target.getRole();
        target.changeRole(role);

        log.info("Member role changed: workspace={}, member={}, {} -> {}, by user={}",
                workspaceId, memberId, previous, role, actorId);
        return workspaceMemberMapper.toResponse(target);
    }

    /**
     * Removes a member. Any member may remove themselves; removing someone else needs admin.
     *
     * @return the confirmation message for the caller
     */
    @Transactional
    public String removeMember(Long actorId, Long workspaceId, Long memberId) {
        WorkspaceMember actor = permissionService.requireMember(actorId, workspaceId);
        WorkspaceMember target = findInWorkspace(memberId, workspaceId);

        Long targetUserId = target.getUser().getId();
        if (target.getWorkspace().isOwnedBy(targetUserId)) {
            throw new OwnerProtectionException(
                    "Cannot remove workspace owner. Transfer ownership first or delete the workspace.");
        }

        boolean selfRemoval = target.belongsTo(actorId);
        if (!selfRemoval) {
            requireAdmin(actor);
        }

        taskRepository.deleteAssignmentsOfUser(workspaceId, targetUserId);
        onboardingProgressRepository.deleteByWorkspaceIdAndUserId(workspaceId, targetUserId);
        workspaceMemberRepository.deleteById(memberId);

        log.info("Member removed: workspace={}, member={}, user={}, self={}",
                workspaceId, memberId, targetUserId, selfRemoval);
        return selfRemoval ? LEFT_MESSAGE : REMOVED_MESSAGE;
    }

    /**
     * Cross-tenant lookup: a member row of another workspace is reported as no access, not as missing.
     */
    WorkspaceMember findInWorkspace(Long memberId, Long workspaceId) {
        return workspaceMemberRepository.findByIdAndWorkspaceId(memberId, workspaceId)
                .orElseThrow(() -> {
                    if (workspaceMemberRepository.existsById(memberId)) {
                        log.warn("Access denied: member={} is outside workspace={}", memberId, workspaceId);
                        return new AccessDeniedException(PermissionService.NO_ACCESS_MESSAGE);
                    }
                    return new MemberNotFoundException("Member not found with id: " + memberId);
                });
    }

    private void requireAdmin(WorkspaceMember actor) {
        if (!permissionService.isAdmin(actor)) {
            log.warn("Access denied: user={} has role={} in workspace={}, required=[ADMIN]",
                    actor.getUser().getId(), actor.getRole(), actor.getWorkspace().getId());
            throw new InsufficientRoleException(List.of(WorkspaceRole.ADMIN), actor.getRole());
        }
    }
}
