package com.taskboard.workspace.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class WorkspaceRoleConverter implements AttributeConverter<WorkspaceRole, String> {

    @Override
    public String convertToDatabaseColumn(WorkspaceRole role) {
        return role == null ? null : role.getValue();
    }

    @Override
    public WorkspaceRole convertToEntityAttribute(String value) {
        return value == null ? null : WorkspaceRole.fromValue(value);
    }
}
