package com.taskboard.workspace.dto;

import com.taskboard.workspace.domain.WorkspaceRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcceptInvitationResponse {
    private String message;
    private Long workspaceId;
    private String workspaceName;
    private WorkspaceRole role;
    private boolean needsOnboarding;
}
