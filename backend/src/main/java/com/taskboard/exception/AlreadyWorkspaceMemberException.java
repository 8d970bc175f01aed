package com.taskboard.exception;

public class AlreadyWorkspaceMemberException extends ConflictException {
    public AlreadyWorkspaceMemberException(String message) {
        super(message);
    }
}
