package com.taskboard.exception;

public class InvitationEmailMismatchException extends RuntimeException {
    public InvitationEmailMismatchException(String message) {
        super(message);
    }
}
