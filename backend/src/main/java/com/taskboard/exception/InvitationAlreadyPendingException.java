package com.taskboard.exception;

public class InvitationAlreadyPendingException extends ConflictException {
    public InvitationAlreadyPendingException(String message) {
        super(message);
    }
}
