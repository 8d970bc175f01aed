package com.taskboard.workspace.dto;

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
public class WorkspaceResponse {
    private Long id;
    private String name;
    private Long ownerId;
    private WorkspaceRole role;
    private long memberCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
