package com.taskboard.onboarding.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnboardingProgressResponse {
    private String message;
    private int currentStep;
    private List<String> stepsCompleted;
    private int totalSteps;
}
