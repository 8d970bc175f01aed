package com.taskboard.workspace.domain;

public enum InvitationStatus {
    PENDING,
    ACCEPTED,
    EXPIRED
}
