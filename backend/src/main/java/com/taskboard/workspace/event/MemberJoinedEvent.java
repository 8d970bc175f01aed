package com.taskboard.workspace.event;

import com.taskboard.workspace.domain.WorkspaceRole;

/**
 * A user became a member of a workspace by accepting an invitation.
 */
public record MemberJoinedEvent(Long workspaceId, Long userId, WorkspaceRole role) {
}
