package com.taskboard.workspace.dto;

import com.taskboard.common.notification.DispatchResult;
import com.taskboard.workspace.domain.InvitationStatus;
import com.taskboard.workspace.domain.WorkspaceRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceInviteResponse {
    private Long id;
    private Long workspaceId;
    private String email;
    private WorkspaceRole role;
    private String token;
    private InvitationStatus status;
    private LocalDateTime expiresAt;
    private LocalDateTime createdAt;
    private DispatchResult deliveryStatus;
    private String message;
}
