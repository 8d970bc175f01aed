package com.taskboard.exception;

/**
 * Thrown when an invitation token is used after its expiry time.
 */
public class InvitationExpiredException extends RuntimeException {
    public InvitationExpiredException(String message) {
        super(message);
    }
}
