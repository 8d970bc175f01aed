package com.taskboard.task.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum TaskStatus {
    TODO("todo"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    @JsonValue
    private final String value;

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid status. Must be: todo, in_progress, or completed"));
    }
}
