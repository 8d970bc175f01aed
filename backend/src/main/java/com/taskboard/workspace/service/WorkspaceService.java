package com.taskboard.workspace.service;

import com.taskboard.category.repository.CategoryRepository;
import com.taskboard.common.service.PermissionService;
import com.taskboard.config.TaskboardProperties;
import com.taskboard.exception.InvalidRequestException;
import com.taskboard.exception.WorkspaceNotFoundException;
import com.taskboard.onboarding.repository.OnboardingProgressRepository;
import com.taskboard.task.repository.TaskRepository;
import com.taskboard.user.domain.User;
import com.taskboard.workspace.domain.Workspace;
import com.taskboard.workspace.domain.WorkspaceMember;
import com.taskboard.workspace.domain.WorkspaceRole;
import com.taskboard.workspace.dto.MemberResponse;
import com.taskboard.workspace.dto.WorkspaceCreateRequest;
import com.taskboard.workspace.dto.WorkspaceDeleteResponse;
import com.taskboard.workspace.dto.WorkspaceResponse;
import com.taskboard.workspace.dto.WorkspaceUpdateRequest;
import com.taskboard.workspace.mapper.WorkspaceMapper;
import com.taskboard.workspace.mapper.WorkspaceMemberMapper;
import com.taskboard.workspace.repository.WorkspaceInvitationRepository;
import com.taskboard.workspace.repository.WorkspaceMemberRepository;
import com.taskboard.workspace.repository.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Workspace domain service.
 * Membership and invitation changes live in {@link WorkspaceMemberService} and {@link WorkspaceInvitationService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class WorkspaceService {

    private final WorkspaceRepository workspaceRepository;
    private final WorkspaceMemberRepository workspaceMemberRepository;
    private final WorkspaceInvitationRepository invitationRepository;
    private final CategoryRepository categoryRepository;
    private final TaskRepository taskRepository;
    private final OnboardingProgressRepository onboardingProgressRepository;
    private final PermissionService permissionService;
    private final WorkspaceSeeder workspaceSeeder;
    private final WorkspaceMapper workspaceMapper;
    private final WorkspaceMemberMapper workspaceMemberMapper;
    private final TaskboardProperties properties;

    /**
     * Creates the workspace, its owner membership and the default board in one transaction.
     */
    @Transactional
    public WorkspaceResponse createWorkspace(User owner, WorkspaceCreateRequest request) {
        String name = normalizeName(request.getName());

        Workspace saved = workspaceRepository.save(Workspace.builder()
                .name(name)
                .owner(owner)
                .build());

        workspaceMemberRepository.save(WorkspaceMember.builder()
                .workspace(saved)
                .user(owner)
                .role(WorkspaceRole.ADMIN)
                .build());

        if (properties.getWorkspace().isSeedDefaults()) {
            workspaceSeeder.seed(saved, owner);
        }

        log.info("Workspace created: id={}, owner={}", saved.getId(), owner.getId());
        return workspaceMapper.toResponse(saved, WorkspaceRole.ADMIN, 1L);
    }

    public List<WorkspaceResponse> getMyWorkspaces(Long userId) {
        List<WorkspaceMember> memberships = workspaceMemberRepository.findByUserIdWithWorkspace(userId);
        if (memberships.isEmpty()) {
            return List.of();
        }

        List<Long> workspaceIds = memberships.stream()
                .map(membership -> membership.getWorkspace().getId())
                .collect(Collectors.toList());
        Map<Long, Long> counts = workspaceMemberRepository.countByWorkspaceIds(workspaceIds).stream()
                .collect(Collectors.toMap(WorkspaceMemberRepository.MemberCount::getWorkspaceId,
                        WorkspaceMemberRepository.MemberCount::getMemberCount));

        return memberships.stream()
                .map(membership -> workspaceMapper.toResponse(membership.getWorkspace(), membership.getRole(),
                        counts.getOrDefault(membership.getWorkspace().getId(), 0L)))
                .collect(Collectors.toList());
    }

    public WorkspaceResponse getWorkspace(Long userId, Long workspaceId) {
        WorkspaceMember membership = permissionService.requireMember(userId, workspaceId);

        Workspace workspace = findWorkspace(workspaceId);
        return workspaceMapper.toResponse(workspace, membership.getRole(),
                workspaceMemberRepository.countByWorkspaceId(workspaceId));
    }

    @Transactional
    public WorkspaceResponse updateWorkspace(Long userId, Long workspaceId, WorkspaceUpdateRequest request) {
        WorkspaceMember membership = permissionService.requireAdmin(userId, workspaceId);

        Workspace workspace = findWorkspace(workspaceId);
        workspace.rename(normalizeName(request.getName()));
        workspaceRepository.flush();

        return workspaceMapper.toResponse(workspace, membership.getRole(),
                workspaceMemberRepository.countByWorkspaceId(workspaceId));
    }

    /**
     * Deletes the workspace and everything in it. Owner only.
     * Children go first so that no foreign key is left dangling mid-transaction.
     */
    @Transactional
    public WorkspaceDeleteResponse deleteWorkspace(Long userId, Long workspaceId) {
        permissionService.requireMember(userId, workspaceId);

        Workspace workspace = workspaceRepository.findByIdForUpdate(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Workspace not found with id: " + workspaceId));
        permissionService.requireOwner(userId, workspace);

        taskRepository.deleteAssignmentsByWorkspaceId(workspaceId);
        int deletedTasks = taskRepository.deleteSubtasksByWorkspaceId(workspaceId)
                + taskRepository.deleteTopLevelByWorkspaceId(workspaceId);
        int deletedCategories = categoryRepository.deleteByWorkspaceId(workspaceId);
        onboardingProgressRepository.deleteByWorkspaceId(workspaceId);
        int deletedInvitations = invitationRepository.deleteByWorkspaceId(workspaceId);
        int deletedMembers = workspaceMemberRepository.deleteByWorkspaceId(workspaceId);
        workspaceRepository.deleteById(workspaceId);

        log.info("Workspace deleted: id={}, categories={}, tasks={}, members={}, invitations={}",
                workspaceId, deletedCategories, deletedTasks, deletedMembers, deletedInvitations);

        return WorkspaceDeleteResponse.builder()
                .message("Workspace deleted successfully")
                .deletedCategories(deletedCategories)
                .deletedTasks(deletedTasks)
                .deletedMembers(deletedMembers)
                .deletedInvitations(deletedInvitations)
                .build();
    }

    public List<MemberResponse> getMembers(Long userId, Long workspaceId) {
        permissionService.requireMember(userId, workspaceId);

        return workspaceMemberRepository.findByWorkspaceIdWithUser(workspaceId).stream()
                .map(workspaceMemberMapper::toResponse)
                .collect(Collectors.toList());
    }

    private Workspace findWorkspace(Long workspaceId) {
        return workspaceRepository.findById(workspaceId)
                .orElseThrow(() -> new WorkspaceNotFoundException("Workspace not found with id: " + workspaceId));
    }

    private String normalizeName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidRequestException("Workspace name is required");
        }
        if (trimmed.length() > Workspace.MAX_NAME_LENGTH) {
            throw new InvalidRequestException("Workspace name must be 100 characters or less");
        }
        return trimmed;
    }
}
