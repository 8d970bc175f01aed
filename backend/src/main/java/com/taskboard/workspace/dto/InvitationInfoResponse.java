package com.taskboard.workspace.dto;

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
public class InvitationInfoResponse {
    private String workspaceName;
    private String inviterName;
    private String email;
    private WorkspaceRole role;
    private InvitationStatus status;
    private LocalDateTime expiresAt;
}
