package com.taskboard.exception;

import lombok.Getter;

@Getter
public class CategoryNotEmptyException extends ConflictException {

    private final long taskCount;

    public CategoryNotEmptyException(long taskCount) {
        super("Cannot delete category with " + taskCount
                + " task(s). Please move or delete the tasks first.");
        this.taskCount = taskCount;
    }
}
