package com.taskboard.workspace.mapper;

import com.taskboard.workspace.domain.Workspace;
import com.taskboard.workspace.domain.WorkspaceRole;
import com.taskboard.workspace.dto.WorkspaceResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface WorkspaceMapper {

    @Mapping(source = "workspace.owner.id", target = "ownerId")
    @Mapping(source = "role", target = "role")
    @Mapping(source = "memberCount", target = "memberCount")
    WorkspaceResponse toResponse(Workspace workspace, WorkspaceRole role, long memberCount);
}
