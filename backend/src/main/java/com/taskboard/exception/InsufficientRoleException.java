package com.taskboard.exception;

import com.taskboard.workspace.domain.WorkspaceRole;
import lombok.Getter;
import org.springframework.security.access.AccessDeniedException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Member exists but its role is not in the allowed set.
 */
@Getter
public class InsufficientRoleException extends AccessDeniedException {

    private final List<WorkspaceRole> requiredRoles;
    private final WorkspaceRole actualRole;

    public InsufficientRoleException(List<WorkspaceRole> requiredRoles, WorkspaceRole actualRole) {
        super("This action requires one of these roles: "
                + requiredRoles.stream().map(WorkspaceRole::getValue).collect(Collectors.joining(", "))
                + ". Your role: " + actualRole.getValue());
        this.requiredRoles = List.copyOf(requiredRoles);
        this.actualRole = actualRole;
    }
}
