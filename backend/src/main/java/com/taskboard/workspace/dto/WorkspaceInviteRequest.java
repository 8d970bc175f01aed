package com.taskboard.workspace.dto;

import com.taskboard.workspace.domain.WorkspaceRole;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceInviteRequest {

    // format is checked by the service after trimming and lowercasing
    @NotBlank(message = "Email is required")
    private String email;

    private WorkspaceRole role;
}
