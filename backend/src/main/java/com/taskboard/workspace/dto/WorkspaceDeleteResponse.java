package com.taskboard.workspace.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspaceDeleteResponse {
    private String message;
    private int deletedCategories;
    private int deletedTasks;
    private int deletedMembers;
    private int deletedInvitations;
}
