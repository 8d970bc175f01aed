package com.taskboard.onboarding.repository;

import com.taskboard.onboarding.domain.OnboardingProgress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface OnboardingProgressRepository extends JpaRepository<OnboardingProgress, Long> {

    Optional<OnboardingProgress> findByWorkspaceIdAndUserId(Long workspaceId, Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from OnboardingProgress p where p.workspace.id = :workspaceId")
    int deleteByWorkspaceId(@Param("workspaceId") Long workspaceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from OnboardingProgress p where p.workspace.id = :workspaceId and p.user.id = :userId")
    int deleteByWorkspaceIdAndUserId(@Param("workspaceId") Long workspaceId, @Param("userId") Long userId);
}
