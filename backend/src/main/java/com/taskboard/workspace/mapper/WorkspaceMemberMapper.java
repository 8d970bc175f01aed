package com.taskboard.workspace.mapper;

import com.taskboard.workspace.domain.WorkspaceMember;
import com.taskboard.workspace.dto.MemberResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface WorkspaceMemberMapper {

    @Mapping(source = "user.id", target = "userId")
    @Mapping(source = "user.name", target = "name")
    @Mapping(source = "user.email", target = "email")
    @Mapping(target = "owner", expression = "java(member.getWorkspace().isOwnedBy(member.getUser().getId()))")
    MemberResponse toResponse(WorkspaceMember member);
}
