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
public class MemberResponse {
    private Long id;
    private Long userId;
    private String name;
    private String email;
    private WorkspaceRole role;
    private boolean owner;
    private LocalDateTime joinedAt;
}
