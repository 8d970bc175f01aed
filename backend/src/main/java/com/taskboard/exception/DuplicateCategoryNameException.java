package com.taskboard.exception;

public class DuplicateCategoryNameException extends ConflictException {
    public DuplicateCategoryNameException(String message) {
        super(message);
    }
}
