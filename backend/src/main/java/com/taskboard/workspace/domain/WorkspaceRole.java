package com.taskboard.workspace.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Fixed per-workspace roles. Persisted and serialized as the lowercase value.
 */
@Getter
@RequiredArgsConstructor
public enum WorkspaceRole {
    ADMIN("admin"),
    MEMBER("member"),
    VIEWER("viewer");

    @JsonValue
    private final String value;

    /**
     * Admins and members may write; viewers are read-only.
     */
    public boolean canMutate() {
        return this == ADMIN || this == MEMBER;
    }

    public boolean isAdmin() {
        return this == ADMIN;
    }

    @JsonCreator
    public static WorkspaceRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(role -> role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid role: " + value
                        + ". Must be one of: admin, member, viewer"));
    }
}
