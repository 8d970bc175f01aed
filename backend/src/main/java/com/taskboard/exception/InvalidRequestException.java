package com.taskboard.exception;

/**
 * Generic validation failure raised by the service layer, mapped to 400.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
