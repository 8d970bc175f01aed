package com.taskboard.workspace.dto;

import com.taskboard.workspace.domain.WorkspaceRole;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberRoleUpdateRequest {

    @NotNull(message = "Role is required")
    private WorkspaceRole role;
}
