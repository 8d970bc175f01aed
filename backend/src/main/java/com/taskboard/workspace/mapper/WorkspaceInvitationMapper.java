package com.taskboard.workspace.mapper;

import com.taskboard.common.notification.DispatchResult;
import com.taskboard.workspace.domain.WorkspaceInvitation;
import com.taskboard.workspace.dto.InvitationInfoResponse;
import com.taskboard.workspace.dto.InvitationResponse;
import com.taskboard.workspace.dto.WorkspaceInviteResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface WorkspaceInvitationMapper {

    @Mapping(source = "invitation.workspace.id", target = "workspaceId")
    @Mapping(source = "deliveryStatus", target = "deliveryStatus")
    @Mapping(source = "message", target = "message")
    WorkspaceInviteResponse toInviteResponse(WorkspaceInvitation invitation, DispatchResult deliveryStatus,
                                             String message);

    @Mapping(source = "inviter.name", target = "invitedByName")
    InvitationResponse toResponse(WorkspaceInvitation invitation);

    @Mapping(source = "workspace.name", target = "workspaceName")
    @Mapping(source = "inviter.name", target = "inviterName")
    InvitationInfoResponse toInfo(WorkspaceInvitation invitation);
}
