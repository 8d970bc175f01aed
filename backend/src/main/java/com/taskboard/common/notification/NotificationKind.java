package com.taskboard.common.notification;

public enum NotificationKind {
    WORKSPACE_INVITATION,
    TASK_ASSIGNED
}
