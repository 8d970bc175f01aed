package com.taskboard.onboarding.dto;

import com.taskboard.workspace.domain.WorkspaceRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnboardingStatusResponse {
    private boolean completed;
    private boolean skipped;
    private int currentStep;
    private List<String> stepsCompleted;
    private int totalSteps;
    private List<String> steps;
    private LocalDateTime completedAt;
    private LocalDateTime skippedAt;
    private WorkspaceRole userRole;
    private Long workspaceId;
    private String workspaceName;
    private String ownerName;
    private long memberCount;
    private long categoryCount;
    private long taskCount;
}
