package com.taskboard.onboarding.service;

import com.taskboard.category.repository.CategoryRepository;
import com.taskboard.common.service.PermissionService;
import com.taskboard.exception.InvalidRequestException;
import com.taskboard.onboarding.domain.OnboardingProgress;
import com.taskboard.onboarding.domain.OnboardingStep;
import com.taskboard.onboarding.dto.OnboardingProgressRequest;
import com.taskboard.onboarding.dto.OnboardingProgressResponse;
import com.taskboard.onboarding.dto.OnboardingStatusResponse;
import com.taskboard.onboarding.repository.OnboardingProgressRepository;
import com.taskboard.task.repository.TaskRepository;
import com.taskboard.workspace.domain.Workspace;
import com.taskboard.workspace.domain.WorkspaceMember;
import com.taskboard.workspace.repository.WorkspaceMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Onboarding walkthrough shown to members after they join a workspace.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OnboardingService {

    private final OnboardingProgressRepository progressRepository;
    private final WorkspaceMemberRepository workspaceMemberRepository;
    private final CategoryRepository categoryRepository;
    private final TaskRepository taskRepository;
    private final PermissionService permissionService;

    public OnboardingStatusResponse getStatus(Long userId, Long workspaceId) {
        WorkspaceMember member = permissionService.requireMember(userId, workspaceId);
        Workspace workspace = member.getWorkspace();
        Optional<OnboardingProgress> progress = progressRepository.findByWorkspaceIdAndUserId(workspaceId, userId);

        LocalDateTime completedAt = progress.map(OnboardingProgress::getCompletedAt)
                .orElse(member.getOnboardingCompletedAt());
        return OnboardingStatusResponse.builder()
                .completed(member.getOnboardingCompletedAt() != null || completedAt != null)
                .skipped(progress.map(p -> p.getSkippedAt() != null).orElse(false))
                .currentStep(progress.map(OnboardingProgress::displayStep).orElse(1))
                .stepsCompleted(progress.map(OnboardingProgress::getStepsCompleted).orElse(List.of()))
                .totalSteps(OnboardingStep.TOTAL_STEPS)
                .steps(OnboardingStep.names())
                .completedAt(completedAt)
                .skippedAt(progress.map(OnboardingProgress::getSkippedAt).orElse(null))
                .userRole(member.getRole())
                .workspaceId(workspaceId)
                .workspaceName(workspace.getName())
                .ownerName(workspace.getOwner().getName())
                .memberCount(workspaceMemberRepository.countByWorkspaceId(workspaceId))
                .categoryCount(categoryRepository.countByWorkspaceId(workspaceId))
                .taskCount(taskRepository.countByWorkspaceId(workspaceId))
                .build();
    }

    /**
     * Starts the walkthrough, or restarts it from step 1.
     */
    @Transactional
    public OnboardingProgressResponse start(Long userId, Long workspaceId) {
        WorkspaceMember member = permissionService.requireMember(userId, workspaceId);

        OnboardingProgress progress = findOrCreate(member);
        progress.restart();
        progressRepository.save(progress);

        return toResponse("Onboarding started", progress);
    }

    @Transactional
    public OnboardingProgressResponse updateProgress(Long userId, Long workspaceId, OnboardingProgressRequest request) {
        OnboardingStep step = resolveStep(request);
        WorkspaceMember member = permissionService.requireMember(userId, workspaceId);

        OnboardingProgress progress = findOrCreate(member);
        progress.recordStep(step);
        progressRepository.save(progress);

        return toResponse("Step \"" + step.getValue() + "\" completed", progress);
    }

    /**
     * Completes onboarding: progress row and membership are updated in one transaction.
     */
    @Transactional
    public OnboardingProgressResponse complete(Long userId, Long workspaceId) {
        WorkspaceMember member = permissionService.requireMember(userId, workspaceId);
        LocalDateTime now = LocalDateTime.now();

        OnboardingProgress progress = findOrCreate(member);
        progress.complete(now);
        progressRepository.save(progress);
        member.markOnboardingCompleted(now);

        log.info("Onboarding completed: workspace={}, user={}", workspaceId, userId);
        return toResponse("Onboarding completed successfully", progress);
    }

    @Transactional
    public OnboardingProgressResponse skip(Long userId, Long workspaceId) {
        WorkspaceMember member = permissionService.requireMember(userId, workspaceId);
        LocalDateTime now = LocalDateTime.now();

        OnboardingProgress progress = findOrCreate(member);
        progress.skip(now);
        progressRepository.save(progress);
        member.markOnboardingCompleted(now);

        log.info("Onboarding skipped: workspace={}, user={}", workspaceId, userId);
        return toResponse("Onboarding skipped", progress);
    }

    private OnboardingStep resolveStep(OnboardingProgressRequest request) {
        if (request.getStep() == null && (request.getStepName() == null || request.getStepName().isBlank())) {
            throw new InvalidRequestException("step number or stepName is required");
        }
        if (request.getStepName() != null && !request.getStepName().isBlank()) {
            return OnboardingStep.fromValue(request.getStepName());
        }
        return OnboardingStep.fromNumber(request.getStep());
    }

    private OnboardingProgress findOrCreate(WorkspaceMember member) {
        return progressRepository
                .findByWorkspaceIdAndUserId(member.getWorkspace().getId(), member.getUser().getId())
                .orElseGet(() -> OnboardingProgress.builder()
                        .workspace(member.getWorkspace())
                        .user(member.getUser())
                        .build());
    }

    private OnboardingProgressResponse toResponse(String message, OnboardingProgress progress) {
        return OnboardingProgressResponse.builder()
                .message(message)
                .currentStep(progress.displayStep())
                .stepsCompleted(List.copyOf(progress.getStepsCompleted()))
                .totalSteps(OnboardingStep.TOTAL_STEPS)
                .build();
    }
}
