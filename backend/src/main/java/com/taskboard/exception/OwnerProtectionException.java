package com.taskboard.exception;

/**
 * Thrown when an operation would demote or remove the workspace owner.
 */
public class OwnerProtectionException extends RuntimeException {
    public OwnerProtectionException(String message) {
        super(message);
    }
}
