package com.taskboard.workspace.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceUpdateRequest {

    @NotBlank(message = "Workspace name is required")
    @Size(max = 100, message = "Workspace name must be 100 characters or less")
    private String name;
}
