package com.taskboard.exception;

public class InvitationAlreadyAcceptedException extends ConflictException {
    public InvitationAlreadyAcceptedException(String message) {
        super(message);
    }
}
