package com.taskboard.exception;

/**
 * Unknown token, or an invitation already used by a different account.
 */
public class InvalidInvitationException extends RuntimeException {
    public InvalidInvitationException(String message) {
        super(message);
    }
}
