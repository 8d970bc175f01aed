package com.taskboard.onboarding.domain;

import com.taskboard.user.domain.User;
import com.taskboard.workspace.domain.Workspace;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-member onboarding walkthrough state within one workspace.
 */
@Entity
@Table(name = "workspace_onboarding_progress",
        uniqueConstraints = @UniqueConstraint(columnNames = {"workspace_id", "user_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OnboardingProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "workspace_id", nullable = false)
    private Workspace workspace;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false)
    private int currentStep;

    @Convert(converter = StepListConverter.class)
    @Column(name = "steps_completed", nullable = false)
    private List<String> stepsCompleted = new ArrayList<>();

    private LocalDateTime skippedAt;

    private LocalDateTime completedAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    @Builder
    public OnboardingProgress(Workspace workspace, User user) {
        this.workspace = workspace;
        this.user = user;
        this.currentStep = 1;
    }

    public void restart() {
        currentStep = 1;
        stepsCompleted = new ArrayList<>();
        skippedAt = null;
        completedAt = null;
    }

    /**
     * Marks {@code step} done. The current step only moves forward.
     */
    public void recordStep(OnboardingStep step) {
        currentStep = Math.max(currentStep, step.number() + 1);
        if (!stepsCompleted.contains(step.getValue())) {
            List<String> updated = new ArrayList<>(stepsCompleted);
            updated.add(step.getValue());
            stepsCompleted = updated;
        }
    }

    public void complete(LocalDateTime at) {
        currentStep = OnboardingStep.TOTAL_STEPS;
        stepsCompleted = new ArrayList<>(OnboardingStep.names());
        completedAt = at;
    }

    public void skip(LocalDateTime at) {
        skippedAt = at;
    }

    /**
     * Step to display, capped at the last step.
     */
    public int displayStep() {
        return Math.min(currentStep, OnboardingStep.TOTAL_STEPS);
    }
}
