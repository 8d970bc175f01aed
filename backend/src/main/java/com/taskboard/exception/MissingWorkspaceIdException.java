package com.taskboard.exception;

public class MissingWorkspaceIdException extends InvalidRequestException {
    public MissingWorkspaceIdException() {
        super("workspace_id is required");
    }
}
