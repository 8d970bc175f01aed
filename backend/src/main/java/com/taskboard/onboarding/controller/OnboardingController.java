package com.taskboard.onboarding.controller;

import com.taskboard.onboarding.dto.OnboardingProgressRequest;
import com.taskboard.onboarding.dto.OnboardingProgressResponse;
import com.taskboard.onboarding.dto.OnboardingStatusResponse;
import com.taskboard.onboarding.service.OnboardingService;
import com.taskboard.user.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import static com.taskboard.common.controller.ResponseHelper.ok;

@RestController
@RequestMapping("/api/workspaces/{workspaceId}/onboarding")
@RequiredArgsConstructor
public class OnboardingController {

    private final OnboardingService onboardingService;

    @GetMapping
    public ResponseEntity<OnboardingStatusResponse> getStatus(
            @PathVariable Long workspaceId,
            @AuthenticationPrincipal User user) {
        return ok(onboardingService.getStatus(user.getId(), workspaceId));
    }

    @PostMapping("/start")
    public ResponseEntity<OnboardingProgressResponse> start(
            @PathVariable Long workspaceId,
            @AuthenticationPrincipal User user) {
        return ok(onboardingService.start(user.getId(), workspaceId));
    }

    /**
     * 단계 번호(step) 또는 단계 이름(stepName) 중 하나로 진행 상황을 기록합니다.
     */
    @PutMapping("/progress")
    public ResponseEntity<OnboardingProgressResponse> updateProgress(
            @PathVariable Long workspaceId,
            @RequestBody OnboardingProgressRequest request,
            @AuthenticationPrincipal User user) {
        return ok(onboardingService.updateProgress(user.getId(), workspaceId, request));
    }

    @PostMapping("/complete")
    public ResponseEntity<OnboardingProgressResponse> complete(
            @PathVariable Long workspaceId,
            @AuthenticationPrincipal User user) {
        return ok(onboardingService.complete(user.getId(), workspaceId));
    }

    @PostMapping("/skip")
    public ResponseEntity<OnboardingProgressResponse> skip(
            @PathVariable Long workspaceId,
            @AuthenticationPrincipal User user) {
        return ok(onboardingService.skip(user.getId(), workspaceId));
    }
}
