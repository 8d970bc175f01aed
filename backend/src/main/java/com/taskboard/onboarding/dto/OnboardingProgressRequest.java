package com.taskboard.onboarding.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Either a 1-based step number or a step name.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OnboardingProgressRequest {
    private Integer step;
    private String stepName;
}
