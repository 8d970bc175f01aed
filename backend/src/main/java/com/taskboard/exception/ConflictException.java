package com.taskboard.exception;

/**
 * Base type for requests that contradict the current state of the workspace (409).
 */
public abstract class ConflictException extends RuntimeException {
    protected ConflictException(String message) {
        super(message);
    }
}
