package com.taskboard.exception;

public class MixedScopeReorderException extends ConflictException {
    public MixedScopeReorderException(String message) {
        super(message);
    }
}
